package at.sv.mixer.catalog;

import at.sv.mixer.color.ColorTriple;
import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.databind.ObjectReader;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvParser;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Reads a pigment catalog from CSV with the header {@code code,name,manufacturer,category,L,a,b}.
 * Additional columns are ignored.
 */
@Slf4j
public final class CsvPigmentCatalog implements PigmentCatalog {

    private static final List<String> REQUIRED_COLUMNS = List.of("code", "name", "manufacturer", "category", "L", "a", "b");
    private static final CsvMapper MAPPER = CsvMapper.builder()
                                                     .enable(CsvParser.Feature.SKIP_EMPTY_LINES)
                                                     .enable(CsvParser.Feature.TRIM_SPACES)
                                                     .build();

    private final List<PigmentEntry> pigments;

    private CsvPigmentCatalog(List<PigmentEntry> pigments) {
        this.pigments = List.copyOf(pigments);
    }

    public static CsvPigmentCatalog load(Path file) {
        try (Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            CsvPigmentCatalog catalog = read(reader);
            log.info("Loaded {} pigments from '{}'", catalog.pigments.size(), file);
            return catalog;
        } catch (IOException e) {
            throw new CatalogLoadException("Failed to read pigment catalog '" + file + "': " + e.getMessage(), e);
        }
    }

    public static CsvPigmentCatalog read(Reader reader) throws IOException {
        CsvSchema schema = CsvSchema.emptySchema().withHeader();
        ObjectReader csvReader = MAPPER.readerForMapOf(String.class).with(schema);
        List<PigmentEntry> pigments = new ArrayList<>();
        try (MappingIterator<Map<String, String>> rows = csvReader.readValues(reader)) {
            int line = 1;
            while (rows.hasNext()) {
                line++;
                pigments.add(parseRow(rows.next(), line));
            }
        }
        return new CsvPigmentCatalog(pigments);
    }

    private static PigmentEntry parseRow(Map<String, String> row, int line) {
        for (String column : REQUIRED_COLUMNS) {
            String value = row.get(column);
            if (value == null || value.isBlank()) {
                throw new CatalogLoadException("Missing value for column '" + column + "' in catalog line " + line);
            }
        }
        double lightness = parseNumber(row, "L", line);
        if (lightness < 0 || lightness > 100) {
            throw new CatalogLoadException("Invalid lightness '" + lightness + "' in catalog line " + line +
                                           ". Allowed range: 0-100");
        }
        return PigmentEntry.builder()
                           .code(row.get("code").trim())
                           .name(row.get("name").trim())
                           .manufacturer(row.get("manufacturer").trim())
                           .category(row.get("category").trim())
                           .lab(new ColorTriple(lightness,
                                   parseNumber(row, "a", line),
                                   parseNumber(row, "b", line)))
                           .build();
    }

    private static double parseNumber(Map<String, String> row, String column, int line) {
        String value = row.get(column).trim();
        double number;
        try {
            number = Double.parseDouble(value);
        } catch (NumberFormatException e) {
            throw new CatalogLoadException("Invalid number '" + value + "' for column '" + column +
                                           "' in catalog line " + line, e);
        }
        if (!Double.isFinite(number)) {
            throw new CatalogLoadException("Invalid number '" + value + "' for column '" + column +
                                           "' in catalog line " + line + ". Only finite numbers are allowed");
        }
        return number;
    }

    @Override
    public List<PigmentEntry> getPigments() {
        return pigments;
    }
}
