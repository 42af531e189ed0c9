package org.carball.relinfer.analyzer;

import lombok.extern.slf4j.Slf4j;
import org.carball.relinfer.model.candidate.CandidateKey;
import org.carball.relinfer.model.proposal.RelationshipProposal;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Keeps the highest-confidence proposal per (table, field, target) and orders
 * the survivors by descending confidence. On equal confidence the first
 * proposal seen wins and ordering falls back to the key.
 */
@Slf4j
public class ProposalDeduplicator {

    public List<RelationshipProposal> deduplicate(List<RelationshipProposal> proposals) {
        Map<CandidateKey, RelationshipProposal> best = new LinkedHashMap<>();

        for (RelationshipProposal proposal : proposals) {
            best.merge(proposal.key(), proposal,
                    (current, candidate) -> candidate.getConfidence() > current.getConfidence() ? candidate : current);
        }

        List<RelationshipProposal> survivors = new ArrayList<>(best.values());
        survivors.sort(Comparator.comparingDouble(RelationshipProposal::getConfidence).reversed()
                .thenComparing(RelationshipProposal::key));

        if (survivors.size() < proposals.size()) {
            log.info("Deduplicated {} proposals into {}", proposals.size(), survivors.size());
        }
        return survivors;
    }
}
