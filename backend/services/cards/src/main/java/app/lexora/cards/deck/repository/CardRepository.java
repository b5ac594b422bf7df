package app.lexora.cards.deck.repository;

import app.lexora.cards.deck.domain.entity.CardEntity;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface CardRepository extends JpaRepository<CardEntity, UUID> {

    Page<CardEntity> findByDeckIdOrderByCreatedAtAsc(UUID deckId, Pageable pageable);

    List<CardEntity> findByDeckIdOrderByCreatedAtAsc(UUID deckId);

    Optional<CardEntity> findByCardIdAndDeckId(UUID cardId, UUID deckId);

    long countByDeckId(UUID deckId);

    @Query("select c.normalizedWord from CardEntity c where c.deckId = :deckId")
    List<String> findNormalizedWordsByDeckId(@Param("deckId") UUID deckId);
}
