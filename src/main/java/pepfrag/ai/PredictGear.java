package pepfrag.ai;

import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.CommandLineParser;
import org.apache.commons.cli.DefaultParser;
import org.apache.commons.cli.HelpFormatter;
import org.apache.commons.cli.Options;
import org.apache.commons.cli.ParseException;
import org.apache.commons.io.FileUtils;
import pepfrag.dia.IonPrediction;
import pepfrag.dia.MissingIonPolicy;
import pepfrag.dia.NormalizationMode;
import pepfrag.dia.ObservedSpectrum;
import pepfrag.dia.PredictedSpectrum;
import pepfrag.dia.SpectrumAssembler;
import pepfrag.dia.SpectrumCorrelation;
import pepfrag.dia.SpectrumCorrelator;
import pepfrag.error.ModelLoadException;
import pepfrag.error.PredictionException;
import pepfrag.input.MgfReader;
import pepfrag.input.ModificationTable;
import pepfrag.input.PParameter;
import pepfrag.input.PeprecReader;
import pepfrag.input.PeptideRecord;
import pepfrag.input.PeptideResolver;
import pepfrag.input.ResidueTable;
import pepfrag.util.PLogger;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Command line entry point: predict fragment ion intensities for a PEPREC file or a single
 * peptide, and optionally correlate the predictions with spectra from an MGF file.
 */
public class PredictGear {

    public static void main(String[] args) throws ParseException, IOException {
        System.exit(run(args));
    }

    static Options buildOptions(){
        Options options = new Options();
        options.addOption("i", true, "Peptide file in PEPREC format (spec_id, modifications, peptide, charge)");
        options.addOption("peptide", true, "Predict a single peptide sequence instead of a PEPREC file");
        options.addOption("mods_str", true, "Modifications of the single peptide in PEPREC format, such as 0|Acetyl|4|Oxidation, default is -");
        options.addOption("charge", true, "Precursor charge of the single peptide, default is 2");
        options.addOption("o", true, "Output prefix, default is the input file name without extension");
        options.addOption("m", true, "Fragmentation method / model: HCD (default), HCD2019, CID, ETD, TMT, iTRAQ, ...");
        options.addOption("model_dir", true, "Directory with models.json or the manifest file itself");
        options.addOption("mods", true, "Modification definition file, one 'name,mass,opt|fix,site' per line. These are added to the default modifications");
        options.addOption("conf", true, "Configuration file in properties format");
        options.addOption("cpu", true, "The number of threads, 0 (default) to use all available processors");
        options.addOption("chunk", true, "The maximum number of peptides per chunk, default is 1000");
        options.addOption("norm", true, "Intensity normalization: relative-max (default), raw or log");
        options.addOption("missing", true, "Ions without prediction: fill (default) or omit");
        options.addOption("minLength", true, "The minimum peptide length, default is 4");
        options.addOption("maxLength", true, "The maximum peptide length, default is 100");
        options.addOption("f", true, "Output format: tsv (default) or parquet");
        options.addOption("mgf", true, "Observed spectra in MGF format. Predictions are correlated with the spectra whose title matches the spec_id");
        options.addOption("spec_id_pattern", true, "Regular expression extracting the spec_id from MGF titles as its first group, default is (.*)");
        options.addOption("ms2_tolerance", true, "m/z tolerance in Da to match predicted ions to observed peaks, default is 0.02");
        options.addOption("printMods", false, "Print all supported modifications");
        options.addOption("h", false, "Help");
        return options;
    }

    /**
     * @return the process exit code
     */
    static int run(String[] args) throws ParseException, IOException {
        Options options = buildOptions();
        CommandLineParser parser = new DefaultParser(false);
        CommandLine cmd = parser.parse(options, args);
        if (cmd.hasOption("h") || args.length == 0) {
            HelpFormatter f = new HelpFormatter();
            f.setWidth(100);
            f.setOptionComparator(null);
            System.out.println("pepfrag " + PParameter.getVersion());
            System.out.println("java -Xmx4G -jar pepfrag.jar");
            f.printHelp("Options", options);
            return 0;
        }

        ModificationTable.Builder modBuilder = ModificationTable.builder().addDefaults();
        if(cmd.hasOption("mods")){
            modBuilder.addAll(FileUtils.readLines(new File(cmd.getOptionValue("mods")), StandardCharsets.UTF_8));
        }
        ModificationTable modificationTable = modBuilder.build();
        if (cmd.hasOption("printMods")) {
            modificationTable.printMods();
            return 0;
        }

        PParameter parameter = PParameter.loadDefaults();
        if(cmd.hasOption("conf")){
            parameter.load(Path.of(cmd.getOptionValue("conf")));
        }
        if(cmd.hasOption("m")){
            parameter.method = cmd.getOptionValue("m");
        }
        if(cmd.hasOption("model_dir")){
            parameter.model_dir = cmd.getOptionValue("model_dir");
        }
        if(cmd.hasOption("cpu")){
            parameter.cpu = Integer.parseInt(cmd.getOptionValue("cpu"));
        }
        if(cmd.hasOption("chunk")){
            parameter.chunk_size = Integer.parseInt(cmd.getOptionValue("chunk"));
        }
        if(cmd.hasOption("norm")){
            parameter.normalization = NormalizationMode.fromLabel(cmd.getOptionValue("norm"));
        }
        if(cmd.hasOption("missing")){
            parameter.missing_ion_policy = MissingIonPolicy.fromLabel(cmd.getOptionValue("missing"));
        }
        if(cmd.hasOption("minLength")){
            parameter.min_peptide_length = Integer.parseInt(cmd.getOptionValue("minLength"));
        }
        if(cmd.hasOption("maxLength")){
            parameter.max_peptide_length = Integer.parseInt(cmd.getOptionValue("maxLength"));
        }
        if(cmd.hasOption("f")){
            parameter.output_format = cmd.getOptionValue("f");
        }
        if(cmd.hasOption("ms2_tolerance")){
            parameter.ms2_tolerance = Double.parseDouble(cmd.getOptionValue("ms2_tolerance"));
        }
        parameter.validate();

        if(!cmd.hasOption("i") && !cmd.hasOption("peptide")){
            PLogger.getInstance().logger.error("Please provide a peptide file with -i or a peptide with -peptide");
            return 1;
        }
        if(parameter.model_dir.isEmpty()){
            PLogger.getInstance().logger.error("Please provide the model directory with -model_dir");
            return 1;
        }

        PLogger.getInstance().set_job_start_time();
        PLogger.getInstance().logger.info("pepfrag " + PParameter.getVersion());
        PLogger.getInstance().logger.info("Parameters:\n" + parameter.describe());

        ModelRegistry registry;
        try {
            registry = ModelRegistry.loadAll(Path.of(parameter.model_dir));
        } catch (ModelLoadException e) {
            PLogger.getInstance().logger.error("Failed to load models: " + e.getMessage(), e);
            return 1;
        }

        PeptideEncoder encoder = new PeptideEncoder(FeatureSchema.V1, ResidueTable.getDefault());
        SpectrumPredictor predictor = new SpectrumPredictor(
                new PeptideResolver(ResidueTable.getDefault(), modificationTable, parameter.min_peptide_length, parameter.max_peptide_length),
                encoder,
                new PredictionEngine(registry),
                new SpectrumAssembler(parameter.normalization, parameter.missing_ion_policy, encoder));

        if(cmd.hasOption("peptide")){
            return predictSingle(cmd, parameter, predictor);
        }

        String input = cmd.getOptionValue("i");
        String outPrefix = cmd.hasOption("o") ? cmd.getOptionValue("o") : input.replaceAll("\\.[^./\\\\]+$", "");
        List<PeptideRecord> peptides = PeprecReader.read(Path.of(input));
        PLogger.getInstance().logger.info("Read " + peptides.size() + " peptides from " + input);

        BatchOrchestrator orchestrator = new BatchOrchestrator(predictor, parameter.getThreads());
        List<PeptideResult> results = orchestrator.run(peptides, parameter.method, parameter.chunk_size);

        PredictionWriter.write(results, outPrefix, parameter.output_format);
        if(cmd.hasOption("mgf")){
            Pattern titlePattern = cmd.hasOption("spec_id_pattern") ? Pattern.compile(cmd.getOptionValue("spec_id_pattern")) : MgfReader.DEFAULT_TITLE_PATTERN;
            List<SpectrumCorrelation> correlations = correlate(results, Path.of(cmd.getOptionValue("mgf")), titlePattern, parameter.ms2_tolerance);
            PredictionWriter.writeCorrelations(correlations, Path.of(outPrefix + "_correlations.tsv"));
        }
        PLogger.getInstance().logger.info("Total time: " + PLogger.getInstance().get_job_run_time());
        return 0;
    }

    private static int predictSingle(CommandLine cmd, PParameter parameter, SpectrumPredictor predictor) throws IOException {
        int charge = cmd.hasOption("charge") ? Integer.parseInt(cmd.getOptionValue("charge")) : 2;
        String mods = cmd.hasOption("mods_str") ? cmd.getOptionValue("mods_str") : "-";
        PeptideRecord record;
        try {
            record = PeptideRecord.fromPeprec("peptide", cmd.getOptionValue("peptide"), mods, charge);
        } catch (IllegalArgumentException e) {
            PLogger.getInstance().logger.error("Invalid modification string '" + mods + "': " + e.getMessage());
            return 1;
        }
        PredictedSpectrum spectrum;
        try {
            spectrum = predictor.predict(record, parameter.method);
        } catch (PredictionException e) {
            PLogger.getInstance().logger.error(e.getKind() + ": " + e.getMessage());
            return 1;
        }
        if(cmd.hasOption("o")){
            PredictionWriter.write(Collections.singletonList(PeptideResult.ok(record.getId(), spectrum)), cmd.getOptionValue("o"), parameter.output_format);
        }else{
            System.out.println(String.join("\t", PredictionWriter.COLUMNS));
            for(IonPrediction ion : spectrum.getIons()){
                System.out.println(spectrum.getId() + "\t" + spectrum.getPrecursorCharge() + "\t" + ion.getIonType().getSeries()
                        + "\t" + ion.getIonNumber() + "\t" + ion.getCharge() + "\t" + ion.getMz() + "\t" + ion.getIntensity());
            }
        }
        return 0;
    }

    /**
     * Correlate the successful predictions with the observed spectra sharing their id.
     */
    static List<SpectrumCorrelation> correlate(List<PeptideResult> results, Path mgf, Pattern titlePattern, double tolerance) throws IOException {
        Set<String> wanted = new HashSet<>();
        for(PeptideResult r : results){
            if(r.isOk()){
                wanted.add(r.getId());
            }
        }
        Map<String, ObservedSpectrum> observed = MgfReader.read(mgf, titlePattern, wanted);
        SpectrumCorrelator correlator = new SpectrumCorrelator(tolerance);
        List<SpectrumCorrelation> correlations = new ArrayList<>();
        for(PeptideResult r : results){
            if(r.isOk() && observed.containsKey(r.getId())){
                correlations.add(correlator.correlate(r.getSpectrum(), observed.get(r.getId())));
            }
        }
        if(correlations.size() < wanted.size()){
            PLogger.getInstance().logger.warn((wanted.size() - correlations.size()) + " predicted peptides have no spectrum in " + mgf);
        }
        return correlations;
    }
}
