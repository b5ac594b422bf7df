package app.lexora.cards.deck.service;

import app.lexora.cards.audio.AudioStorage;
import app.lexora.cards.deck.domain.entity.CardEntity;
import app.lexora.cards.deck.domain.entity.DeckEntity;
import app.lexora.cards.deck.domain.type.ExportFormat;
import app.lexora.cards.deck.repository.CardRepository;
import app.lexora.cards.generation.model.AudioRef;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVPrinter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.OutputStreamWriter;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.zip.ZipEntry;
import java.util.zip.ZipOutputStream;

/**
 * Deck export in two shapes. {@code apkg} is an Anki package ready for import. {@code csv} is a zip
 * with {@code deck.csv} holding one note per card plus the audio files under {@code media/}. Both use
 * Anki's {@code [sound:...]} syntax in the Audio field.
 */
@Service
public class DeckExportService {

    private static final Logger log = LoggerFactory.getLogger(DeckExportService.class);

    static final String CSV_NAME = "deck.csv";
    static final String MEDIA_DIR = "media/";
    static final String[] HEADERS = AnkiPackageWriter.FIELDS.toArray(String[]::new);

    private final DeckService deckService;
    private final CardRepository cardRepository;
    private final AudioStorage audioStorage;
    private final AnkiPackageWriter ankiPackageWriter;

    public DeckExportService(DeckService deckService,
                             CardRepository cardRepository,
                             AudioStorage audioStorage,
                             AnkiPackageWriter ankiPackageWriter) {
        this.deckService = deckService;
        this.cardRepository = cardRepository;
        this.audioStorage = audioStorage;
        this.ankiPackageWriter = ankiPackageWriter;
    }

    @Transactional(readOnly = true)
    public DeckExport export(UUID ownerId, UUID deckId, ExportFormat format) {
        DeckEntity deck = deckService.requireOwnedDeck(ownerId, deckId);
        List<CardEntity> cards = cardRepository.findByDeckIdOrderByCreatedAtAsc(deckId);

        List<AnkiPackageWriter.Note> notes = new ArrayList<>(cards.size());
        List<AnkiPackageWriter.Media> media = new ArrayList<>();
        for (CardEntity card : cards) {
            Optional<byte[]> audio = card.getAudioFile() == null
                    ? Optional.empty()
                    : audioStorage.load(new AudioRef(card.getAudioFile()));
            audio.ifPresent(bytes -> media.add(new AnkiPackageWriter.Media(card.getAudioFile(), bytes)));
            notes.add(new AnkiPackageWriter.Note(card.getCardId(), List.of(
                    card.getWord(),
                    card.getTranslation(),
                    card.getExample(),
                    card.getExampleTranslation(),
                    card.getContext() == null ? "" : card.getContext(),
                    audio.isPresent() ? "[sound:" + card.getAudioFile() + "]" : ""
            )));
        }

        ExportFormat resolved = format == null ? ExportFormat.apkg : format;
        try {
            DeckExport export = switch (resolved) {
                case apkg -> new DeckExport(
                        exportFileName(deck.getTitle(), "apkg"),
                        DeckExport.APKG_CONTENT_TYPE,
                        ankiPackageWriter.write(deckId, deckName(deck.getTitle()), notes, media)
                );
                case csv -> new DeckExport(
                        exportFileName(deck.getTitle(), "zip"),
                        DeckExport.ZIP_CONTENT_TYPE,
                        csvZip(notes, media)
                );
            };
            log.info("Deck exported deckId={} format={} cards={} mediaFiles={}",
                    deckId, resolved, cards.size(), media.size());
            return export;
        } catch (IOException ex) {
            throw new UncheckedIOException("Deck export failed for deck " + deckId, ex);
        }
    }

    private byte[] csvZip(List<AnkiPackageWriter.Note> notes, List<AnkiPackageWriter.Media> media) throws IOException {
        ByteArrayOutputStream buffer = new ByteArrayOutputStream();
        try (ZipOutputStream zos = new ZipOutputStream(buffer)) {
            zos.putNextEntry(new ZipEntry(CSV_NAME));
            Writer writer = new OutputStreamWriter(zos, StandardCharsets.UTF_8);
            CSVPrinter printer = new CSVPrinter(writer, CSVFormat.DEFAULT.builder().setHeader(HEADERS).build());
            for (AnkiPackageWriter.Note note : notes) {
                printer.printRecord(note.fields());
            }
            printer.flush();
            zos.closeEntry();

            for (AnkiPackageWriter.Media file : media) {
                zos.putNextEntry(new ZipEntry(MEDIA_DIR + file.fileName()));
                zos.write(file.content());
                zos.closeEntry();
            }
        }
        return buffer.toByteArray();
    }

    private String deckName(String title) {
        return title == null || title.isBlank() ? "Lexora" : title.trim();
    }

    private String exportFileName(String title, String extension) {
        String base = title == null ? "" : title.trim().replaceAll("[^\\p{L}\\p{N}._-]+", "-");
        base = base.replaceAll("(^-+|-+$)", "");
        return (base.isEmpty() ? "deck" : base) + "." + extension;
    }

    public record DeckExport(String fileName, String contentType, byte[] content) {

        public static final String APKG_CONTENT_TYPE = "application/apkg";
        public static final String ZIP_CONTENT_TYPE = "application/zip";
    }
}
