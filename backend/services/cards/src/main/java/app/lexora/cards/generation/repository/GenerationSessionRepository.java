package app.lexora.cards.generation.repository;

import app.lexora.cards.generation.domain.entity.GenerationSessionEntity;
import app.lexora.cards.generation.domain.type.GenerationStatus;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.UUID;

@Repository
public interface GenerationSessionRepository extends JpaRepository<GenerationSessionEntity, UUID> {

    List<GenerationSessionEntity> findByDeckIdOrderByCreatedAtDesc(UUID deckId, Pageable pageable);

    List<GenerationSessionEntity> findByStatusInAndCreatedAtBefore(Collection<GenerationStatus> statuses,
                                                                   Instant cutoff);

    @Query("""
            select s.sessionId from GenerationSessionEntity s
            where s.status in :statuses
              and s.completedAt < :cutoff
            """)
    List<UUID> findFinalizedBefore(@Param("statuses") Collection<GenerationStatus> statuses,
                                   @Param("cutoff") Instant cutoff);
}
