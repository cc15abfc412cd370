package com.gt.asjp.wordlist;

import com.gt.asjp.exception.AsjpFormatException;
import com.gt.asjp.model.WordList;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.Resource;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Reads the tab separated ASJP database export.
 *
 * The first ten columns describe the language (among them "names" and "iso"), every following column
 * holds the word forms of one concept. Synonymous forms within a field are separated by ", ".
 */
public class AsjpDatabaseLoader {

    private static final Logger log = LoggerFactory.getLogger(AsjpDatabaseLoader.class);

    public static final String ISO_COLUMN = "iso";
    public static final String NAME_COLUMN = "names";
    public static final int FIRST_CONCEPT_COLUMN = 10;

    private static final String FIELD_DELIMITER = "\t";
    private static final String FORM_DELIMITER = ", ";

    public List<WordList> load(Resource resource) throws IOException {
        log.info("Loading ASJP database from {}", resource.getDescription());

        try (InputStream inputStream = resource.getInputStream()) {
            return load(inputStream);
        }
    }

    public List<WordList> load(InputStream inputStream) throws IOException {
        // newDecoder() reports malformed input instead of substituting it
        BufferedReader reader = new BufferedReader(new InputStreamReader(inputStream, StandardCharsets.UTF_8.newDecoder()));

        try {
            return readWordLists(reader);
        } catch (CharacterCodingException ex) {
            throw new AsjpFormatException("ASJP database is not valid UTF-8", ex);
        }
    }

    private List<WordList> readWordLists(BufferedReader reader) throws IOException {
        String headerLine = reader.readLine();
        if (headerLine == null) {
            throw new AsjpFormatException("ASJP database is empty");
        }

        List<String> header = Arrays.asList(headerLine.split(FIELD_DELIMITER, -1));
        int isoIndex = requireColumn(header, ISO_COLUMN);
        int nameIndex = requireColumn(header, NAME_COLUMN);
        List<String> conceptNames = header.size() > FIRST_CONCEPT_COLUMN ? header.subList(FIRST_CONCEPT_COLUMN, header.size()) : List.of();

        List<WordList> wordLists = new ArrayList<>();
        String line;
        while ((line = reader.readLine()) != null) {
            if (line.isBlank()) {
                continue;
            }

            String[] fields = line.split(FIELD_DELIMITER, -1);
            wordLists.add(new WordList(field(fields, isoIndex), field(fields, nameIndex), readConcepts(fields, conceptNames)));
        }

        log.info("Read {} word lists for {} concepts", wordLists.size(), conceptNames.size());
        return wordLists;
    }

    private Map<String, List<String>> readConcepts(String[] fields, List<String> conceptNames) {
        Map<String, List<String>> concepts = new LinkedHashMap<>();

        for (int i = 0; i < conceptNames.size(); i++) {
            String value = field(fields, FIRST_CONCEPT_COLUMN + i);
            if (!value.isEmpty()) {
                concepts.put(conceptNames.get(i), List.of(value.split(FORM_DELIMITER, -1)));
            }
        }

        return concepts;
    }

    // Rows may be shorter than the header, missing trailing fields count as empty
    private static String field(String[] fields, int index) {
        return index < fields.length ? fields[index] : "";
    }

    private static int requireColumn(List<String> header, String column) {
        int index = header.indexOf(column);
        if (index < 0) {
            throw new AsjpFormatException("ASJP database header has no " + column + " column");
        }

        return index;
    }
}
