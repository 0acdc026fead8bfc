package com.evobus.proposal;

import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Consumer;
import java.util.stream.Collectors;

@Component
public class InMemoryProposalStore implements ProposalStore {

    private final ConcurrentHashMap<String, Proposal> proposals = new ConcurrentHashMap<>();

    @Override
    public Proposal save(Proposal proposal) {
        Proposal stored = proposal.copy();
        if (proposals.putIfAbsent(stored.getId(), stored) != null) {
            throw new PersistenceException("proposal already exists: " + stored.getId());
        }
        return stored.copy();
    }

    @Override
    public Optional<Proposal> findById(String id) {
        if (id == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(proposals.get(id)).map(Proposal::copy);
    }

    @Override
    public Proposal update(String id, Consumer<Proposal> mutation) {
        if (id == null) {
            throw new ProposalNotFoundException(null);
        }
        Proposal updated = proposals.compute(id, (key, existing) -> {
            if (existing == null) {
                throw new ProposalNotFoundException(key);
            }
            Proposal working = existing.copy();
            mutation.accept(working);
            return working;
        });
        return updated.copy();
    }

    @Override
    public List<Proposal> findByStatus(ProposalStatus status) {
        return proposals.values().stream()
            .filter(p -> p.getStatus() == status)
            .sorted(Comparator.comparing(Proposal::getCreatedAt))
            .map(Proposal::copy)
            .collect(Collectors.toCollection(ArrayList::new));
    }

    @Override
    public List<Proposal> findAll() {
        return proposals.values().stream()
            .sorted(Comparator.comparing(Proposal::getCreatedAt))
            .map(Proposal::copy)
            .collect(Collectors.toCollection(ArrayList::new));
    }
}
