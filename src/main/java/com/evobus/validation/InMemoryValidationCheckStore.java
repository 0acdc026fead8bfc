package com.evobus.validation;

import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.stream.Collectors;

@Component
public class InMemoryValidationCheckStore implements ValidationCheckStore {

    private final CopyOnWriteArrayList<ValidationCheckRecord> records = new CopyOnWriteArrayList<>();

    @Override
    public void append(ValidationCheckRecord record) {
        records.add(record);
    }

    @Override
    public List<ValidationCheckRecord> findByCheck(String checkId) {
        return records.stream()
            .filter(r -> r.checkId().equals(checkId))
            .collect(Collectors.toCollection(ArrayList::new));
    }

    @Override
    public List<ValidationCheckRecord> findSince(Instant since) {
        return records.stream()
            .filter(r -> !r.timestamp().isBefore(since))
            .collect(Collectors.toCollection(ArrayList::new));
    }
}
