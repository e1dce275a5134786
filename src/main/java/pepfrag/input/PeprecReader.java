package pepfrag.input;

import tech.tablesaw.api.ColumnType;
import tech.tablesaw.api.Table;
import tech.tablesaw.io.csv.CsvReadOptions;

import java.io.BufferedReader;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Reads PEPREC peptide lists: a header line with at least {@code spec_id}, {@code modifications},
 * {@code peptide} and {@code charge}, separated by spaces, tabs or commas.
 */
public final class PeprecReader {

    public static final String[] REQUIRED_COLUMNS = {"spec_id", "modifications", "peptide", "charge"};

    private PeprecReader(){
    }

    /**
     * Rows with a malformed modification string are kept with an out-of-range modification, so
     * they fail individually as invalid modifications.
     *
     * @throws IOException if the file cannot be read or misses a required column
     */
    public static List<PeptideRecord> read(Path file) throws IOException {
        char separator = detectSeparator(file);
        Map<String, ColumnType> types = new HashMap<>();
        types.put("spec_id", ColumnType.STRING);
        types.put("modifications", ColumnType.STRING);
        types.put("peptide", ColumnType.STRING);
        types.put("charge", ColumnType.INTEGER);
        CsvReadOptions options = CsvReadOptions.builder(file.toFile())
                .separator(separator)
                .header(true)
                .missingValueIndicator("")
                .columnTypesPartial(types)
                .build();
        Table table = Table.read().usingOptions(options);
        for(String column : REQUIRED_COLUMNS){
            if(!table.columnNames().contains(column)){
                throw new IOException("Column '" + column + "' missing in PEPREC file " + file);
            }
        }
        List<PeptideRecord> records = new ArrayList<>(table.rowCount());
        for(int i=0;i<table.rowCount();i++){
            String id = table.getString(i, "spec_id");
            String mods = table.getString(i, "modifications");
            String peptide = table.getString(i, "peptide");
            int charge = table.intColumn("charge").isMissing(i) ? 0 : table.intColumn("charge").getInt(i);
            try {
                records.add(PeptideRecord.fromPeprec(id, peptide, mods, charge));
            } catch (IllegalArgumentException e) {
                // keep the row so the resolver reports it as an invalid modification
                records.add(new PeptideRecord(id, peptide, Collections.singletonList(new PeptideModification(-1, mods)), charge));
            }
        }
        return records;
    }

    static char detectSeparator(Path file) throws IOException {
        String head;
        try (BufferedReader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            head = reader.readLine();
        }
        if(head == null){
            throw new IOException("Empty PEPREC file: " + file);
        }
        if(head.contains("\t")){
            return '\t';
        }else if(head.contains(",")){
            return ',';
        }
        return ' ';
    }
}
