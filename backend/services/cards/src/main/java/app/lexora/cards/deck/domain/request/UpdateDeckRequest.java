package app.lexora.cards.deck.domain.request;

import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;

/**
 * Partial update; {@code null} fields are left unchanged.
 */
public record UpdateDeckRequest(
        @Size(max = 200) @Pattern(regexp = "(?s).*\\S.*", message = "must not be blank") String title,
        @Size(max = 2000) String description
) {
}
