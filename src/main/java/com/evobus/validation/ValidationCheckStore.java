package com.evobus.validation;

import java.time.Instant;
import java.util.List;

public interface ValidationCheckStore {

    void append(ValidationCheckRecord record);

    /** Every run of one check, oldest first. */
    List<ValidationCheckRecord> findByCheck(String checkId);

    /** Runs of every check at or after {@code since}. */
    List<ValidationCheckRecord> findSince(Instant since);
}
