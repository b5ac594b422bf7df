package app.lexora.cards.deck.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Clock;
import java.util.HexFormat;
import java.util.List;
import java.util.UUID;
import java.util.zip.ZipEntry;
import java.util.zip.ZipOutputStream;

/**
 * Writes an Anki package: a zip holding a legacy {@code collection.anki2} SQLite collection, the
 * {@code media} index and the numbered media files. One note type with a single card template is
 * shared by every exported deck so repeated imports land in the same note type.
 */
@Component
public class AnkiPackageWriter {

    private static final Logger log = LoggerFactory.getLogger(AnkiPackageWriter.class);

    static final String COLLECTION_NAME = "collection.anki2";
    static final String MEDIA_NAME = "media";
    static final String FIELD_SEPARATOR = "\u001f";
    static final long MODEL_ID = 1_740_000_000_000L;
    static final List<String> FIELDS = List.of(
            "Term", "Translation", "Example", "ExampleTranslation", "Context", "Audio"
    );

    private static final String MODEL_NAME = "Lexora Vocabulary";
    private static final String QUESTION_FORMAT = "{{Term}}<br>{{Audio}}";
    private static final String ANSWER_FORMAT = "{{FrontSide}}<hr id=answer>"
            + "<b>Translation:</b> {{Translation}}<br><br>"
            + "<b>Example:</b> {{Example}}<br>"
            + "<b>Example translation:</b> {{ExampleTranslation}}<br><br>"
            + "{{#Context}}<b>Context:</b> {{Context}}{{/Context}}";
    private static final String CSS = ".card { font-family: arial; font-size: 20px; text-align: center; "
            + "color: black; background-color: white; }";

    private static final String[] SCHEMA = {
            "create table col (id integer primary key, crt integer not null, mod integer not null,"
                    + " scm integer not null, ver integer not null, dty integer not null, usn integer not null,"
                    + " ls integer not null, conf text not null, models text not null, decks text not null,"
                    + " dconf text not null, tags text not null)",
            "create table notes (id integer primary key, guid text not null, mid integer not null,"
                    + " mod integer not null, usn integer not null, tags text not null, flds text not null,"
                    + " sfld integer not null, csum integer not null, flags integer not null, data text not null)",
            "create table cards (id integer primary key, nid integer not null, did integer not null,"
                    + " ord integer not null, mod integer not null, usn integer not null, type integer not null,"
                    + " queue integer not null, due integer not null, ivl integer not null, factor integer not null,"
                    + " reps integer not null, lapses integer not null, left integer not null, odue integer not null,"
                    + " odid integer not null, flags integer not null, data text not null)",
            "create table revlog (id integer primary key, cid integer not null, usn integer not null,"
                    + " ease integer not null, ivl integer not null, lastIvl integer not null, factor integer not null,"
                    + " time integer not null, type integer not null)",
            "create table graves (usn integer not null, oid integer not null, type integer not null)",
            "create index ix_notes_usn on notes (usn)",
            "create index ix_cards_usn on cards (usn)",
            "create index ix_revlog_usn on revlog (usn)",
            "create index ix_cards_nid on cards (nid)",
            "create index ix_cards_sched on cards (did, queue, due)",
            "create index ix_revlog_cid on revlog (cid)",
            "create index ix_notes_csum on notes (csum)"
    };

    private final ObjectMapper objectMapper;
    private final Clock clock;

    public AnkiPackageWriter(ObjectMapper objectMapper, Clock clock) {
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    public byte[] write(UUID deckId, String deckName, List<Note> notes, List<Media> media) throws IOException {
        Path tempDir = Files.createTempDirectory("lexora-apkg-");
        try {
            Path collection = tempDir.resolve(COLLECTION_NAME);
            writeCollection(collection, deckId, deckName, notes);
            return zip(collection, media);
        } finally {
            cleanup(tempDir);
        }
    }

    private void writeCollection(Path collection, UUID deckId, String deckName, List<Note> notes) throws IOException {
        long nowMillis = clock.millis();
        long ankiDeckId = ankiDeckId(deckId);
        try (Connection connection = DriverManager.getConnection("jdbc:sqlite:" + collection.toAbsolutePath())) {
            connection.setAutoCommit(false);
            try (Statement statement = connection.createStatement()) {
                for (String ddl : SCHEMA) {
                    statement.execute(ddl);
                }
            }
            insertCollectionRow(connection, nowMillis, ankiDeckId, deckName);
            insertNotes(connection, notes, nowMillis, ankiDeckId);
            connection.commit();
        } catch (SQLException ex) {
            throw new IOException("Failed to write Anki collection", ex);
        }
    }

    private void insertCollectionRow(Connection connection,
                                     long nowMillis,
                                     long ankiDeckId,
                                     String deckName) throws SQLException, IOException {
        long nowSeconds = nowMillis / 1000;
        try (PreparedStatement insert = connection.prepareStatement(
                "insert into col (id, crt, mod, scm, ver, dty, usn, ls, conf, models, decks, dconf, tags)"
                        + " values (1, ?, ?, ?, 11, 0, 0, 0, ?, ?, ?, ?, '{}')")) {
            insert.setLong(1, nowSeconds - nowSeconds % 86_400);
            insert.setLong(2, nowMillis);
            insert.setLong(3, nowMillis);
            insert.setString(4, objectMapper.writeValueAsString(collectionConf(ankiDeckId)));
            insert.setString(5, objectMapper.writeValueAsString(models(ankiDeckId, nowSeconds)));
            insert.setString(6, objectMapper.writeValueAsString(decks(ankiDeckId, deckName, nowSeconds)));
            insert.setString(7, objectMapper.writeValueAsString(deckConfigs()));
            insert.executeUpdate();
        }
    }

    private void insertNotes(Connection connection, List<Note> notes, long nowMillis, long ankiDeckId)
            throws SQLException {
        long nowSeconds = nowMillis / 1000;
        try (PreparedStatement noteInsert = connection.prepareStatement(
                "insert into notes (id, guid, mid, mod, usn, tags, flds, sfld, csum, flags, data)"
                        + " values (?, ?, ?, ?, -1, '', ?, ?, ?, 0, '')");
             PreparedStatement cardInsert = connection.prepareStatement(
                     "insert into cards (id, nid, did, ord, mod, usn, type, queue, due, ivl, factor, reps,"
                             + " lapses, left, odue, odid, flags, data)"
                             + " values (?, ?, ?, 0, ?, -1, 0, 0, ?, 0, 0, 0, 0, 0, 0, 0, 0, '')")) {
            for (int i = 0; i < notes.size(); i++) {
                Note note = notes.get(i);
                long id = nowMillis + i;
                String sortField = note.fields().get(0);

                noteInsert.setLong(1, id);
                noteInsert.setString(2, guid(note.cardId()));
                noteInsert.setLong(3, MODEL_ID);
                noteInsert.setLong(4, nowSeconds);
                noteInsert.setString(5, String.join(FIELD_SEPARATOR, note.fields()));
                noteInsert.setString(6, sortField);
                noteInsert.setLong(7, checksum(sortField));
                noteInsert.addBatch();

                cardInsert.setLong(1, id);
                cardInsert.setLong(2, id);
                cardInsert.setLong(3, ankiDeckId);
                cardInsert.setLong(4, nowSeconds);
                cardInsert.setLong(5, i + 1L);
                cardInsert.addBatch();
            }
            noteInsert.executeBatch();
            cardInsert.executeBatch();
        }
    }

    private ObjectNode collectionConf(long ankiDeckId) {
        ObjectNode conf = objectMapper.createObjectNode();
        conf.putArray("activeDecks").add(ankiDeckId);
        conf.put("curDeck", ankiDeckId);
        conf.put("curModel", Long.toString(MODEL_ID));
        conf.put("newSpread", 0);
        conf.put("collapseTime", 1200);
        conf.put("timeLim", 0);
        conf.put("estTimes", true);
        conf.put("dueCounts", true);
        conf.put("nextPos", 1);
        conf.put("sortType", "noteFld");
        conf.put("sortBackwards", false);
        conf.put("addToCur", true);
        return conf;
    }

    private ObjectNode models(long ankiDeckId, long nowSeconds) {
        ObjectNode model = objectMapper.createObjectNode();
        model.put("id", MODEL_ID);
        model.put("name", MODEL_NAME);
        model.put("type", 0);
        model.put("mod", nowSeconds);
        model.put("usn", -1);
        model.put("sortf", 0);
        model.put("did", ankiDeckId);
        model.put("css", CSS);
        model.put("latexPre", "\\documentclass[12pt]{article}\n\\special{papersize=3in,5in}\n"
                + "\\usepackage[utf8]{inputenc}\n\\usepackage{amssymb,amsmath}\n\\pagestyle{empty}\n"
                + "\\setlength{\\parindent}{0in}\n\\begin{document}\n");
        model.put("latexPost", "\\end{document}");
        model.putArray("tags");
        model.putArray("vers");

        ArrayNode fields = model.putArray("flds");
        for (int ord = 0; ord < FIELDS.size(); ord++) {
            ObjectNode field = fields.addObject();
            field.put("name", FIELDS.get(ord));
            field.put("ord", ord);
            field.put("sticky", false);
            field.put("rtl", false);
            field.put("font", "Arial");
            field.put("size", 20);
            field.putArray("media");
        }

        ObjectNode template = model.putArray("tmpls").addObject();
        template.put("name", "Card 1");
        template.put("ord", 0);
        template.put("qfmt", QUESTION_FORMAT);
        template.put("afmt", ANSWER_FORMAT);
        template.putNull("did");
        template.put("bqfmt", "");
        template.put("bafmt", "");

        // the card needs the Term field to be non-empty
        model.putArray("req").addArray().add(0).add("any").addArray().add(0);

        ObjectNode models = objectMapper.createObjectNode();
        models.set(Long.toString(MODEL_ID), model);
        return models;
    }

    private ObjectNode decks(long ankiDeckId, String deckName, long nowSeconds) {
        ObjectNode decks = objectMapper.createObjectNode();
        decks.set("1", deck(1, "Default", nowSeconds));
        decks.set(Long.toString(ankiDeckId), deck(ankiDeckId, deckName, nowSeconds));
        return decks;
    }

    private ObjectNode deck(long id, String name, long nowSeconds) {
        ObjectNode deck = objectMapper.createObjectNode();
        deck.put("id", id);
        deck.put("name", name);
        deck.put("desc", "");
        deck.put("mod", nowSeconds);
        deck.put("usn", -1);
        deck.put("dyn", 0);
        deck.put("conf", 1);
        deck.put("collapsed", false);
        deck.put("extendNew", 10);
        deck.put("extendRev", 50);
        for (String counter : List.of("newToday", "revToday", "lrnToday", "timeToday")) {
            deck.putArray(counter).add(0).add(0);
        }
        return deck;
    }

    private ObjectNode deckConfigs() {
        ObjectNode config = objectMapper.createObjectNode();
        config.put("id", 1);
        config.put("name", "Default");
        config.put("mod", 0);
        config.put("usn", 0);
        config.put("maxTaken", 60);
        config.put("autoplay", true);
        config.put("timer", 0);
        config.put("replayq", true);
        config.put("dyn", false);

        ObjectNode newCards = config.putObject("new");
        newCards.putArray("delays").add(1).add(10);
        newCards.putArray("ints").add(1).add(4).add(7);
        newCards.put("initialFactor", 2500);
        newCards.put("order", 1);
        newCards.put("perDay", 20);
        newCards.put("bury", true);
        newCards.put("separate", true);

        ObjectNode review = config.putObject("rev");
        review.put("perDay", 200);
        review.put("ease4", 1.3);
        review.put("fuzz", 0.05);
        review.put("ivlFct", 1);
        review.put("maxIvl", 36_500);
        review.put("bury", true);
        review.put("minSpace", 1);

        ObjectNode lapse = config.putObject("lapse");
        lapse.putArray("delays").add(10);
        lapse.put("mult", 0);
        lapse.put("minInt", 1);
        lapse.put("leechFails", 8);
        lapse.put("leechAction", 0);

        ObjectNode configs = objectMapper.createObjectNode();
        configs.set("1", config);
        return configs;
    }

    private byte[] zip(Path collection, List<Media> media) throws IOException {
        ByteArrayOutputStream buffer = new ByteArrayOutputStream();
        try (ZipOutputStream zos = new ZipOutputStream(buffer)) {
            zos.putNextEntry(new ZipEntry(COLLECTION_NAME));
            Files.copy(collection, zos);
            zos.closeEntry();

            ObjectNode index = objectMapper.createObjectNode();
            for (int i = 0; i < media.size(); i++) {
                Media file = media.get(i);
                index.put(Integer.toString(i), file.fileName());
                zos.putNextEntry(new ZipEntry(Integer.toString(i)));
                zos.write(file.content());
                zos.closeEntry();
            }
            zos.putNextEntry(new ZipEntry(MEDIA_NAME));
            zos.write(objectMapper.writeValueAsBytes(index));
            zos.closeEntry();
        }
        return buffer.toByteArray();
    }

    static long ankiDeckId(UUID deckId) {
        // positive and clear of the reserved default deck id
        return (deckId.getMostSignificantBits() & 0x0000_7fff_ffff_ffffL) | 0x0000_4000_0000_0000L;
    }

    static String guid(UUID cardId) {
        return Long.toUnsignedString(cardId.getMostSignificantBits() ^ cardId.getLeastSignificantBits(), 36);
    }

    /**
     * First eight hex digits of the SHA-1 of the sort field, the duplicate check Anki runs on import.
     */
    static long checksum(String sortField) {
        try {
            byte[] digest = MessageDigest.getInstance("SHA-1").digest(sortField.getBytes(StandardCharsets.UTF_8));
            return Long.parseLong(HexFormat.of().formatHex(digest, 0, 4), 16);
        } catch (NoSuchAlgorithmException ex) {
            throw new IllegalStateException("SHA-1 not available", ex);
        }
    }

    private void cleanup(Path tempDir) {
        try (var stream = Files.list(tempDir)) {
            for (Path path : stream.toList()) {
                Files.deleteIfExists(path);
            }
            Files.deleteIfExists(tempDir);
        } catch (IOException ex) {
            log.warn("Temporary export files left behind dir={} message={}", tempDir, ex.getMessage());
        }
    }

    public record Note(UUID cardId, List<String> fields) {

        public Note {
            if (fields == null || fields.size() != FIELDS.size()) {
                throw new IllegalArgumentException("Anki note needs " + FIELDS.size() + " fields");
            }
            fields = List.copyOf(fields);
        }
    }

    public record Media(String fileName, byte[] content) {
    }
}
