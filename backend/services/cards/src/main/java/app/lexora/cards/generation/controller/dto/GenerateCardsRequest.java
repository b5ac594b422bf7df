package app.lexora.cards.generation.controller.dto;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

public record GenerateCardsRequest(
        @NotBlank @Size(max = 2000) String context,
        @NotNull @Min(1) Integer maxCards
) {
}
