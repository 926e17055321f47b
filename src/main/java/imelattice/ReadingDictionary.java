package imelattice;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.*;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.*;
import java.util.concurrent.atomic.AtomicReference;
import java.util.logging.Logger;

/**
 * Reading-to-surface dictionary used to populate a {@link Lattice}.
 *
 * <p>This class supports loading from:
 * <ul>
 *     <li>Tab-separated text files (used during development)</li>
 *     <li>JSON-serialized form produced by {@link #serializeToJson(String)}</li>
 * </ul>
 *
 * <p>Each reading maps to one or more {@link Entry} candidates. The longest and shortest
 * reading lengths are tracked in UTF-16 code units, the same unit the lattice uses for
 * positions.</p>
 *
 * <p>Instances are meant to be loaded once and shared read-only between requests.</p>
 */
public class ReadingDictionary {
    private static final Logger LOGGER = Logger.getLogger(ReadingDictionary.class.getName());

    /**
     * One conversion candidate for a reading.
     */
    @JsonFormat(shape = JsonFormat.Shape.ARRAY)
    @JsonPropertyOrder({"value", "lid", "rid", "wcost"})
    public static class Entry {
        /**
         * Surface form (e.g. "今日").
         */
        public String value;
        /**
         * Left connection-class id.
         */
        public int lid;
        /**
         * Right connection-class id.
         */
        public int rid;
        /**
         * Word cost.
         */
        public int wcost;

        /**
         * Constructs an empty entry for deserialization.
         */
        public Entry() {
            this.value = "";
        }

        /**
         * Constructs a new entry.
         *
         * @param value surface form
         * @param lid   left connection-class id
         * @param rid   right connection-class id
         * @param wcost word cost
         */
        public Entry(String value, int lid, int rid, int wcost) {
            this.value = value;
            this.lid = lid;
            this.rid = rid;
            this.wcost = wcost;
        }

        @Override
        public String toString() {
            return value + "(" + lid + "," + rid + "," + wcost + ")";
        }
    }

    /**
     * Reading → candidates, in file order.
     */
    public Map<String, List<Entry>> entries;

    /**
     * Length of the longest reading.
     */
    public int maxLength;

    /**
     * Length of the shortest reading (0 if empty).
     */
    public int minLength;

    private final AtomicReference<StarterMask> starterMask = new AtomicReference<>();

    /**
     * Constructs an empty dictionary.
     */
    public ReadingDictionary() {
        this.entries = new HashMap<>();
    }

    /**
     * Returns the candidates registered for {@code reading}.
     *
     * @param reading the reading to look up
     * @return an unmodifiable list, empty if the reading is unknown
     */
    public List<Entry> lookup(String reading) {
        List<Entry> list = entries.get(reading);
        return list == null ? Collections.emptyList() : Collections.unmodifiableList(list);
    }

    /**
     * Returns the number of distinct readings.
     *
     * @return reading count
     */
    public int size() {
        return entries.size();
    }

    /**
     * Returns the starter mask over all readings, built on first use.
     *
     * @return the shared {@link StarterMask}
     */
    public StarterMask starterMask() {
        StarterMask v = starterMask.get();
        if (v != null) return v;
        StarterMask built = StarterMask.build(entries.keySet());
        return starterMask.compareAndSet(null, built) ? built : starterMask.get();
    }

    @Override
    public String toString() {
        return "<ReadingDictionary with " + entries.size() + " readings, maxLength=" + maxLength + ">";
    }

    /**
     * Loads a dictionary from a file, choosing the format by extension:
     * {@code .json} is read as JSON, anything else as tab-separated text.
     *
     * @param path the dictionary file
     * @return the loaded dictionary
     * @throws IOException if reading or parsing fails
     */
    public static ReadingDictionary load(Path path) throws IOException {
        if (path.getFileName().toString().toLowerCase(Locale.ROOT).endsWith(".json")) {
            return fromJson(path.toFile());
        }
        return fromText(path);
    }

    /**
     * Loads a dictionary from a classpath resource, choosing the format by extension.
     *
     * @param resPath absolute resource path, e.g. {@code /dicts/readings.txt}
     * @return the loaded dictionary
     * @throws IOException if the resource is missing or cannot be parsed
     */
    public static ReadingDictionary fromResource(String resPath) throws IOException {
        try (InputStream in = ReadingDictionary.class.getResourceAsStream(resPath)) {
            if (in == null) throw new FileNotFoundException("Missing resource: " + resPath);
            if (resPath.toLowerCase(Locale.ROOT).endsWith(".json")) {
                return fromJson(in);
            }
            return fromText(in);
        }
    }

    /**
     * Loads a dictionary from a JSON file.
     *
     * @param jsonFile the JSON file to read
     * @return the parsed dictionary
     * @throws IOException if reading fails
     */
    public static ReadingDictionary fromJson(File jsonFile) throws IOException {
        ObjectMapper mapper = new ObjectMapper();
        ReadingDictionary r = mapper.readValue(jsonFile, ReadingDictionary.class);
        return r.withComputedLengths();
    }

    /**
     * Loads a dictionary from a JSON input stream.
     *
     * @param in the input stream containing the JSON data
     * @return the parsed dictionary
     * @throws IOException if the JSON cannot be read or parsed
     */
    public static ReadingDictionary fromJson(InputStream in) throws IOException {
        ObjectMapper mapper = new ObjectMapper();
        ReadingDictionary r = mapper.readValue(in, ReadingDictionary.class);
        return r.withComputedLengths();
    }

    /**
     * Loads a tab-separated dictionary file.
     *
     * @param file the UTF-8 text file
     * @return the parsed dictionary
     * @throws IOException if the file cannot be opened or read
     */
    public static ReadingDictionary fromText(Path file) throws IOException {
        try (BufferedReader br = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            return fromText(br);
        }
    }

    /**
     * Loads a tab-separated dictionary from a UTF-8 stream.
     *
     * @param in the stream to read; not closed by this method
     * @return the parsed dictionary
     * @throws IOException if an I/O error occurs while reading
     */
    public static ReadingDictionary fromText(InputStream in) throws IOException {
        return fromText(new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8)));
    }

    /**
     * Parses dictionary text.
     *
     * <p>File format rules:</p>
     * <ul>
     *   <li>Each line is {@code reading<TAB>surface}, optionally followed by
     *       {@code <TAB>lid<TAB>rid<TAB>wcost}. Missing numbers default to 0.</li>
     *   <li>Blank lines and lines starting with {@code #} or {@code //} are ignored.</li>
     *   <li>If the first reading starts with a BOM ({@code U+FEFF}), it is stripped.</li>
     *   <li>Malformed lines are logged and skipped.</li>
     * </ul>
     *
     * @param br a reader supplying the text
     * @return the parsed dictionary
     * @throws IOException if an I/O error occurs while reading
     */
    static ReadingDictionary fromText(BufferedReader br) throws IOException {
        ReadingDictionary r = new ReadingDictionary();
        int maxLength = 0;
        int minLength = Integer.MAX_VALUE;
        int lineNo = 0;

        for (String raw; (raw = br.readLine()) != null; ) {
            lineNo++;
            String line = raw;
            if (lineNo == 1 && !line.isEmpty() && line.charAt(0) == '\uFEFF') {
                line = line.substring(1); // strip BOM
            }
            line = line.trim();
            if (line.isEmpty() || line.startsWith("#") || line.startsWith("//")) continue;

            String[] cols = line.split("\t");
            if (cols.length < 2) {
                LOGGER.warning("Malformed (no TAB) at line " + lineNo + ": " + raw);
                continue;
            }

            String key = cols[0].trim();
            String val = cols[1].trim();
            if (key.isEmpty() || val.isEmpty()) {
                LOGGER.warning("Empty reading/surface at line " + lineNo + ": " + raw);
                continue;
            }

            int[] nums = new int[3];
            try {
                for (int i = 0; i < 3 && i + 2 < cols.length; i++) {
                    nums[i] = Integer.parseInt(cols[i + 2].trim());
                }
            } catch (NumberFormatException e) {
                LOGGER.warning("Bad number at line " + lineNo + ": " + raw);
                continue;
            }

            r.entries.computeIfAbsent(key, k -> new ArrayList<>())
                    .add(new Entry(val, nums[0], nums[1], nums[2]));

            int len = key.length(); // UTF-16 length (non-BMP counts as 2)
            if (len > maxLength) maxLength = len;
            if (len < minLength) minLength = len;
        }

        if (r.entries.isEmpty()) {
            maxLength = 0;
            minLength = 0;
        }
        r.maxLength = maxLength;
        r.minLength = minLength;
        return r;
    }

    /**
     * Recomputes {@link #maxLength} and {@link #minLength} from {@link #entries},
     * ignoring whatever values were deserialized.
     *
     * @return {@code this}
     */
    private ReadingDictionary withComputedLengths() {
        if (entries == null) entries = new HashMap<>();
        int max = 0;
        int min = Integer.MAX_VALUE;
        for (String key : entries.keySet()) {
            int len = key.length();
            if (len > max) max = len;
            if (len < min) min = len;
        }
        maxLength = max;
        minLength = entries.isEmpty() ? 0 : min;
        return this;
    }

    /**
     * Serializes this dictionary to a JSON file.
     *
     * @param outputPath the output path where the JSON should be written
     * @throws RuntimeException if writing the file fails
     */
    public void serializeToJson(String outputPath) {
        ObjectMapper mapper = new ObjectMapper();
        try (Writer writer = new OutputStreamWriter(Files.newOutputStream(Paths.get(outputPath)), StandardCharsets.UTF_8)) {
            mapper.writerWithDefaultPrettyPrinter().writeValue(writer, this);
        } catch (IOException e) {
            throw new RuntimeException("Failed to write JSON to: " + outputPath, e);
        }
    }
}
