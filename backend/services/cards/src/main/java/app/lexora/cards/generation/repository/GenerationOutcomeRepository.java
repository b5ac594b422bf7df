package app.lexora.cards.generation.repository;

import app.lexora.cards.generation.domain.composite.GenerationOutcomeId;
import app.lexora.cards.generation.domain.entity.GenerationOutcomeEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;
import java.util.UUID;

@Repository
public interface GenerationOutcomeRepository extends JpaRepository<GenerationOutcomeEntity, GenerationOutcomeId> {

    List<GenerationOutcomeEntity> findBySessionIdOrderByPositionAsc(UUID sessionId);

    List<GenerationOutcomeEntity> findBySessionIdInOrderByPositionAsc(Collection<UUID> sessionIds);

    @Modifying
    @Query("delete from GenerationOutcomeEntity o where o.sessionId in :sessionIds")
    int deleteBySessionIds(@Param("sessionIds") Collection<UUID> sessionIds);
}
