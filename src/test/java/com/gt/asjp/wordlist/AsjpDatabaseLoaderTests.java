package com.gt.asjp.wordlist;

import com.gt.asjp.exception.AsjpFormatException;
import com.gt.asjp.model.WordList;
import com.gt.asjp.util.TestUtils;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.springframework.core.io.ClassPathResource;
import org.springframework.test.context.junit.jupiter.SpringExtension;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@ExtendWith(SpringExtension.class)
public class AsjpDatabaseLoaderTests {

    private static final String HEADER = "names\twls_fam\twls_gen\te\thh\tlat\tlon\tpop\twcode\tiso\tI\tstone\n";

    private AsjpDatabaseLoader asjpDatabaseLoader;

    @BeforeEach
    public void before() {
        asjpDatabaseLoader = new AsjpDatabaseLoader();
    }

    @Test
    public void testLoadTestDatabase() throws IOException {
        List<WordList> wordLists = asjpDatabaseLoader.load(new ClassPathResource("asjp-test.tab"));

        assertEquals(List.of("eng", "eng", "swe", "xta", "xis"), wordLists.stream().map(WordList::identifier).toList());
        assertEquals(TestUtils.getEnglish(), wordLists.get(0));
        assertEquals(TestUtils.getSwedish(), wordLists.get(2));
        assertEquals(TestUtils.getToyA(), wordLists.get(3));
        assertEquals(TestUtils.getIsolate(), wordLists.get(4));

        WordListRegistry registry = WordListRegistry.of(wordLists);
        assertEquals(4, registry.size());
        assertEquals(TestUtils.getEnglish(), registry.get("eng"));
    }

    @Test
    public void testLoad_synonymsAndEmptyFields() throws IOException {
        List<WordList> wordLists = asjpDatabaseLoader.load(stream(HEADER +
                "TEST\tF\tG\t\t\t0\t0\t0\tw\ttst\tEi, mi\t\n"));

        assertEquals(1, wordLists.size());
        WordList wordList = wordLists.get(0);
        assertEquals("tst", wordList.identifier());
        assertEquals("TEST", wordList.displayName());
        assertEquals(List.of("Ei", "mi"), wordList.get("I"));
        assertFalse(wordList.hasConcept("stone"));
    }

    @Test
    public void testLoad_shortRow() throws IOException {
        List<WordList> wordLists = asjpDatabaseLoader.load(stream(HEADER + "TEST\tF\tG\t\t\t0\t0\t0\tw\ttst\n\n"));

        assertEquals(1, wordLists.size());
        assertEquals(0, wordLists.get(0).size());
    }

    @Test
    public void testLoad_invalidEncoding() {
        byte[] header = HEADER.getBytes(StandardCharsets.UTF_8);
        byte[] row = new byte[] { 'T', '\t', (byte) 0xC3, (byte) 0x28, '\n' };
        byte[] content = new byte[header.length + row.length];
        System.arraycopy(header, 0, content, 0, header.length);
        System.arraycopy(row, 0, content, header.length, row.length);

        assertThrows(AsjpFormatException.class, () -> asjpDatabaseLoader.load(new ByteArrayInputStream(content)));
    }

    @Test
    public void testLoad_missingColumns() {
        assertThrows(AsjpFormatException.class, () -> asjpDatabaseLoader.load(stream("names\twls_fam\tI\n")));
        assertThrows(AsjpFormatException.class, () -> asjpDatabaseLoader.load(stream("")));
    }

    private static InputStream stream(String content) {
        return new ByteArrayInputStream(content.getBytes(StandardCharsets.UTF_8));
    }
}
