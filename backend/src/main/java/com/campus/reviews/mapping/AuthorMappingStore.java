package com.campus.reviews.mapping;

import com.campus.reviews.entity.TargetKind;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.util.Optional;
import java.util.UUID;

/**
 * Gateway to the privilege-isolated mapping store. Only ingestion, appeals and
 * the elevated author lookup go through here.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class AuthorMappingStore {

    public static final String TX = "mappingTransactionManager";

    private final AuthorMappingRepository repo;

    @Transactional(transactionManager = TX)
    public AuthorMapping attach(UUID reviewId, Long authorId, TargetKind targetKind, UUID targetId) {
        AuthorMapping m = new AuthorMapping();
        m.setReviewId(reviewId);
        m.setAuthorId(authorId);
        m.setTargetKind(targetKind);
        m.setTargetId(targetId);
        return repo.saveAndFlush(m);
    }

    @Transactional(transactionManager = TX, readOnly = true)
    public Optional<UUID> findReviewId(Long authorId, TargetKind targetKind, UUID targetId) {
        return repo.findByAuthorIdAndTargetKindAndTargetId(authorId, targetKind, targetId)
                .map(AuthorMapping::getReviewId);
    }

    @Transactional(transactionManager = TX, readOnly = true)
    public Optional<AuthorMapping> findByReviewId(UUID reviewId) {
        return repo.findByReviewId(reviewId);
    }

    @Transactional(transactionManager = TX, readOnly = true)
    public boolean isAuthor(UUID reviewId, Long userId) {
        return repo.findByReviewId(reviewId)
                .map(m -> m.getAuthorId().equals(userId))
                .orElse(false);
    }

    /** Drops a mapping whose review no longer exists in the content store. */
    @Transactional(transactionManager = TX)
    public void detach(UUID reviewId) {
        int removed = repo.deleteByReviewId(reviewId);
        if (removed > 0) {
            log.info("Removed stale author mapping for review {}", reviewId);
        }
    }
}
