package app.lexora.cards.deck.repository;

import app.lexora.cards.deck.domain.entity.DeckEntity;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Optional;
import java.util.UUID;

@Repository
public interface DeckRepository extends JpaRepository<DeckEntity, UUID> {

    Page<DeckEntity> findByOwnerIdOrderByCreatedAtDesc(UUID ownerId, Pageable pageable);

    Optional<DeckEntity> findByDeckIdAndOwnerId(UUID deckId, UUID ownerId);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query(value = """
            update app_cards.decks
            set card_count = card_count + :delta,
                updated_at = now()
            where deck_id = :deckId
            """, nativeQuery = true)
    int incrementCardCount(@Param("deckId") UUID deckId, @Param("delta") int delta);
}
