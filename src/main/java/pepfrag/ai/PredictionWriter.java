package pepfrag.ai;

import org.apache.avro.Schema;
import org.apache.avro.SchemaBuilder;
import org.apache.avro.generic.GenericData;
import org.apache.avro.generic.GenericRecord;
import org.apache.parquet.avro.AvroParquetWriter;
import org.apache.parquet.hadoop.ParquetFileWriter;
import org.apache.parquet.hadoop.ParquetWriter;
import org.apache.parquet.hadoop.metadata.CompressionCodecName;
import org.apache.parquet.io.LocalOutputFile;
import pepfrag.dia.IonPrediction;
import pepfrag.dia.PredictedSpectrum;
import pepfrag.dia.SpectrumCorrelation;
import pepfrag.util.PLogger;

import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

/**
 * Writes batch results: one row per predicted ion (TSV or parquet) plus a TSV report of the
 * peptides that failed.
 */
public final class PredictionWriter {

    public static final String[] COLUMNS = {"spec_id", "charge", "ion", "ionnumber", "ion_charge", "mz", "prediction"};

    private PredictionWriter(){
    }

    public static Schema getSchema4Prediction(){
        return SchemaBuilder.record("FragmentPrediction")
                .fields()
                .requiredString("spec_id")
                .requiredInt("charge")
                .requiredString("ion")
                .requiredInt("ionnumber")
                .requiredInt("ion_charge")
                .requiredDouble("mz")
                .requiredDouble("prediction")
                .endRecord();
    }

    /**
     * Write predictions and the error report next to each other:
     * {@code <prefix>_predictions.tsv|parquet} and {@code <prefix>_errors.tsv}.
     *
     * @return number of ion rows written
     */
    public static long write(List<PeptideResult> results, String outPrefix, String format) throws IOException {
        long n;
        if(format.equalsIgnoreCase("parquet")){
            n = writeParquet(results, Path.of(outPrefix + "_predictions.parquet"));
        }else{
            n = writeTsv(results, Path.of(outPrefix + "_predictions.tsv"));
        }
        int n_error = writeErrors(results, Path.of(outPrefix + "_errors.tsv"));
        PLogger.getInstance().logger.info("Wrote " + n + " ion predictions to " + outPrefix + "_predictions." + format.toLowerCase()
                + ", " + n_error + " failed peptides to " + outPrefix + "_errors.tsv");
        return n;
    }

    public static long writeTsv(List<PeptideResult> results, Path file) throws IOException {
        long n = 0;
        try (BufferedWriter writer = Files.newBufferedWriter(file, StandardCharsets.UTF_8)) {
            writer.write(String.join("\t", COLUMNS) + "\n");
            for(PeptideResult result : results){
                if(!result.isOk()){
                    continue;
                }
                PredictedSpectrum spectrum = result.getSpectrum();
                for(IonPrediction ion : spectrum.getIons()){
                    writer.write(spectrum.getId() + "\t" + spectrum.getPrecursorCharge() + "\t" + ion.getIonType().getSeries()
                            + "\t" + ion.getIonNumber() + "\t" + ion.getCharge() + "\t" + ion.getMz() + "\t" + ion.getIntensity() + "\n");
                    n++;
                }
            }
        }
        return n;
    }

    public static long writeParquet(List<PeptideResult> results, Path file) throws IOException {
        Schema schema = getSchema4Prediction();
        long n = 0;
        LocalOutputFile localOutputFile = new LocalOutputFile(file);
        try (ParquetWriter<GenericRecord> pWriter = AvroParquetWriter.<GenericRecord>builder(localOutputFile)
                .withSchema(schema)
                .withCompressionCodec(CompressionCodecName.ZSTD)
                .withPageSize(ParquetWriter.DEFAULT_PAGE_SIZE)
                .withValidation(false)
                .withWriteMode(ParquetFileWriter.Mode.OVERWRITE)
                .withDictionaryEncoding(false)
                .build()) {
            for(PeptideResult result : results){
                if(!result.isOk()){
                    continue;
                }
                PredictedSpectrum spectrum = result.getSpectrum();
                for(IonPrediction ion : spectrum.getIons()){
                    GenericRecord record = new GenericData.Record(schema);
                    record.put("spec_id", spectrum.getId());
                    record.put("charge", spectrum.getPrecursorCharge());
                    record.put("ion", String.valueOf(ion.getIonType().getSeries()));
                    record.put("ionnumber", ion.getIonNumber());
                    record.put("ion_charge", ion.getCharge());
                    record.put("mz", ion.getMz());
                    record.put("prediction", ion.getIntensity());
                    pWriter.write(record);
                    n++;
                }
            }
        }
        return n;
    }

    /**
     * @return number of failed peptides
     */
    public static int writeErrors(List<PeptideResult> results, Path file) throws IOException {
        int n = 0;
        try (BufferedWriter writer = Files.newBufferedWriter(file, StandardCharsets.UTF_8)) {
            writer.write("spec_id\terror\tmessage\n");
            for(PeptideResult result : results){
                if(result.isOk()){
                    continue;
                }
                String message = result.getMessage() == null ? "" : result.getMessage().replaceAll("[\t\r\n]+", " ");
                writer.write(result.getId() + "\t" + result.getError() + "\t" + message + "\n");
                n++;
            }
        }
        return n;
    }

    /**
     * One row per spectrum and ion type plus an "all" row per spectrum.
     */
    public static int writeCorrelations(List<SpectrumCorrelation> correlations, Path file) throws IOException {
        int n = 0;
        try (BufferedWriter writer = Files.newBufferedWriter(file, StandardCharsets.UTF_8)) {
            writer.write("spec_id\tion\tpearsonr\tn_ions\tn_matched\n");
            for(SpectrumCorrelation c : correlations){
                writer.write(c.getId() + "\tall\t" + c.getPearson() + "\t" + c.getIonCount() + "\t" + c.getMatchedCount() + "\n");
                for(Map.Entry<IonType, Double> e : c.getPearsonByIonType().entrySet()){
                    writer.write(c.getId() + "\t" + e.getKey().getLabel() + "\t" + e.getValue() + "\t\t\n");
                }
                n++;
            }
        }
        PLogger.getInstance().logger.info("Wrote correlations of " + n + " spectra to " + file);
        return n;
    }
}
