package com.evobus.proposal;

import java.util.List;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * Proposal persistence. Reads hand out copies; the only way to change a stored
 * proposal is {@link #update}, which runs the mutation atomically for that id.
 */
public interface ProposalStore {

    Proposal save(Proposal proposal);

    Optional<Proposal> findById(String id);

    /**
     * Apply {@code mutation} to the stored proposal under a per-id lock. If the mutation
     * throws, the stored proposal is left untouched.
     *
     * @throws ProposalNotFoundException when no proposal has this id
     */
    Proposal update(String id, Consumer<Proposal> mutation);

    List<Proposal> findByStatus(ProposalStatus status);

    List<Proposal> findAll();
}
