package imelattice;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import java.io.ByteArrayInputStream;
import java.io.File;
import java.io.FileNotFoundException;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.Assert.*;

public class ReadingDictionaryTest {
    @Rule
    public TemporaryFolder folder = new TemporaryFolder();

    private static ReadingDictionary parse(String text) throws IOException {
        return ReadingDictionary.fromText(new ByteArrayInputStream(text.getBytes(StandardCharsets.UTF_8)));
    }

    @Test
    public void testLoadFromResource() throws IOException {
        ReadingDictionary dict = ReadingDictionary.fromResource("/dicts/readings.txt");
        assertEquals(7, dict.size());
        assertEquals(4, dict.maxLength);
        assertEquals(1, dict.minLength);

        List<ReadingDictionary.Entry> kyou = dict.lookup("きょう");
        assertEquals(3, kyou.size());
        assertEquals("今日", kyou.get(0).value);
        assertEquals(10, kyou.get(0).lid);
        assertEquals(10, kyou.get(0).rid);
        assertEquals(3000, kyou.get(0).wcost);
        assertEquals("京", kyou.get(1).value);
    }

    @Test
    public void testMalformedLinesAreSkipped() throws IOException {
        ReadingDictionary dict = ReadingDictionary.fromResource("/dicts/readings.txt");
        assertTrue(dict.lookup("ですね").isEmpty());
        assertTrue(dict.lookup("あめ").isEmpty());
        assertTrue(dict.lookup("").isEmpty());
    }

    @Test
    public void testBomAndDefaults() throws IOException {
        ReadingDictionary dict = parse("\uFEFFあ\t亜\nい\t胃\t5\n");
        assertEquals(2, dict.size());
        assertEquals("亜", dict.lookup("あ").get(0).value);
        ReadingDictionary.Entry i = dict.lookup("い").get(0);
        assertEquals(5, i.lid);
        assertEquals(0, i.rid);
        assertEquals(0, i.wcost);
    }

    @Test
    public void testEmptyDictionary() throws IOException {
        ReadingDictionary dict = parse("# nothing here\n\n");
        assertEquals(0, dict.size());
        assertEquals(0, dict.maxLength);
        assertEquals(0, dict.minLength);
    }

    @Test(expected = UnsupportedOperationException.class)
    public void testLookupResultIsReadOnly() throws IOException {
        parse("あ\t亜\n").lookup("あ").clear();
    }

    @Test
    public void testJsonRoundTrip() throws IOException {
        ReadingDictionary dict = ReadingDictionary.fromResource("/dicts/readings.txt");
        File json = folder.newFile("readings.json");
        dict.serializeToJson(json.getAbsolutePath());

        JsonNode first = new ObjectMapper().readTree(json).get("entries").get("きょう").get(0);
        assertTrue(first.isArray());
        assertEquals("今日", first.get(0).asText());
        assertEquals(3000, first.get(3).asInt());

        ReadingDictionary loaded = ReadingDictionary.load(json.toPath());
        assertEquals(dict.size(), loaded.size());
        assertEquals(dict.maxLength, loaded.maxLength);
        assertEquals(dict.minLength, loaded.minLength);
        assertEquals("天気", loaded.lookup("てんき").get(0).value);
        assertEquals(2800, loaded.lookup("てんき").get(0).wcost);
    }

    @Test
    public void testLoadTextByExtension() throws IOException {
        Path txt = folder.newFile("small.txt").toPath();
        Files.write(txt, "か\t蚊\t1\t2\t3\n".getBytes(StandardCharsets.UTF_8));
        ReadingDictionary dict = ReadingDictionary.load(txt);
        assertEquals(1, dict.size());
        assertEquals(3, dict.lookup("か").get(0).wcost);
    }

    @Test(expected = FileNotFoundException.class)
    public void testMissingResource() throws IOException {
        ReadingDictionary.fromResource("/dicts/missing.txt");
    }

    @Test
    public void testStarterMaskIsCached() throws IOException {
        ReadingDictionary dict = parse("あ\t亜\n");
        assertSame(dict.starterMask(), dict.starterMask());
        assertTrue(dict.starterMask().hasStarter('あ'));
    }

    @Test
    public void testJsonLengthsAreRecomputedFromEntries() throws IOException {
        String json = "{\"entries\":{\"きょう\":[[\"今日\",10,10,3000]],\"は\":[[\"は\",0,0,1]]},"
                + "\"maxLength\":1,\"minLength\":5}";
        ReadingDictionary dict = ReadingDictionary.fromJson(
                new ByteArrayInputStream(json.getBytes(StandardCharsets.UTF_8)));
        assertEquals(3, dict.maxLength);
        assertEquals(1, dict.minLength);

        Lattice lattice = new Lattice();
        new DictionaryLookup(dict).fill(lattice, "きょうは");
        boolean found = false;
        for (Node n : lattice.endNodeChain(3)) {
            if ("今日".equals(n.value)) found = true;
        }
        assertTrue(found);
    }

    @Test
    public void testJsonWithoutLengths() throws IOException {
        String json = "{\"entries\":{\"きょう\":[[\"今日\",10,10,3000]]}}";
        ReadingDictionary dict = ReadingDictionary.fromJson(
                new ByteArrayInputStream(json.getBytes(StandardCharsets.UTF_8)));
        assertEquals(3, dict.maxLength);
        assertEquals(3, dict.minLength);

        ReadingDictionary empty = ReadingDictionary.fromJson(
                new ByteArrayInputStream("{\"entries\":{},\"maxLength\":9}".getBytes(StandardCharsets.UTF_8)));
        assertEquals(0, empty.maxLength);
        assertEquals(0, empty.minLength);
    }
}
