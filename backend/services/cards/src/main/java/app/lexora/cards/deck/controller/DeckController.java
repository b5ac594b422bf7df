package app.lexora.cards.deck.controller;

import app.lexora.cards.deck.domain.dto.DeckDTO;
import app.lexora.cards.deck.domain.request.CreateDeckRequest;
import app.lexora.cards.deck.domain.request.UpdateDeckRequest;
import app.lexora.cards.deck.domain.type.ExportFormat;
import app.lexora.cards.deck.service.DeckExportService;
import app.lexora.cards.deck.service.DeckService;
import app.lexora.cards.security.CurrentUserProvider;
import jakarta.validation.Valid;
import org.springframework.data.domain.Page;
import org.springframework.http.ContentDisposition;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.security.oauth2.jwt.Jwt;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

import java.nio.charset.StandardCharsets;
import java.util.UUID;

@RestController
@RequestMapping("/decks")
public class DeckController {

    private final DeckService deckService;
    private final DeckExportService exportService;
    private final CurrentUserProvider currentUserProvider;

    public DeckController(DeckService deckService,
                          DeckExportService exportService,
                          CurrentUserProvider currentUserProvider) {
        this.deckService = deckService;
        this.exportService = exportService;
        this.currentUserProvider = currentUserProvider;
    }

    // POST /decks
    @PostMapping
    @ResponseStatus(HttpStatus.CREATED)
    public DeckDTO createDeck(
            @AuthenticationPrincipal Jwt jwt,
            @Valid @RequestBody CreateDeckRequest request
    ) {
        var userId = currentUserProvider.getUserId(jwt);
        return deckService.createDeck(userId, request);
    }

    // GET /decks?page=1&limit=10
    @GetMapping
    public Page<DeckDTO> getDecks(
            @AuthenticationPrincipal Jwt jwt,
            @RequestParam(defaultValue = "1") int page,
            @RequestParam(defaultValue = "10") int limit
    ) {
        var userId = currentUserProvider.getUserId(jwt);
        return deckService.getDecks(userId, page, limit);
    }

    // GET /decks/{deckId}
    @GetMapping("/{deckId}")
    public DeckDTO getDeck(
            @AuthenticationPrincipal Jwt jwt,
            @PathVariable UUID deckId
    ) {
        var userId = currentUserProvider.getUserId(jwt);
        return deckService.getDeck(userId, deckId);
    }

    // PATCH /decks/{deckId}
    @PatchMapping("/{deckId}")
    public DeckDTO updateDeck(
            @AuthenticationPrincipal Jwt jwt,
            @PathVariable UUID deckId,
            @Valid @RequestBody UpdateDeckRequest request
    ) {
        var userId = currentUserProvider.getUserId(jwt);
        return deckService.updateDeck(userId, deckId, request);
    }

    // GET /decks/{deckId}/export?format=apkg|csv
    @GetMapping("/{deckId}/export")
    public ResponseEntity<byte[]> exportDeck(
            @AuthenticationPrincipal Jwt jwt,
            @PathVariable UUID deckId,
            @RequestParam(defaultValue = "apkg") ExportFormat format
    ) {
        var userId = currentUserProvider.getUserId(jwt);
        DeckExportService.DeckExport export = exportService.export(userId, deckId, format);
        ContentDisposition disposition = ContentDisposition.attachment()
                .filename(export.fileName(), StandardCharsets.UTF_8)
                .build();
        return ResponseEntity.ok()
                .header(HttpHeaders.CONTENT_DISPOSITION, disposition.toString())
                .contentType(MediaType.parseMediaType(export.contentType()))
                .body(export.content());
    }
}
