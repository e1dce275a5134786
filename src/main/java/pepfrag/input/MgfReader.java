package pepfrag.input;

import com.google.common.primitives.Doubles;
import pepfrag.dia.ObservedSpectrum;
import pepfrag.util.PLogger;

import java.io.BufferedReader;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads observed spectra from an MGF file. A spectrum is identified by its TITLE, or by the
 * first group of {@code titlePattern} when the pattern matches the title.
 */
public final class MgfReader {

    public static final Pattern DEFAULT_TITLE_PATTERN = Pattern.compile("(.*)");

    private MgfReader(){
    }

    /**
     * @param wanted spectrum ids to keep, null keeps all
     * @throws IOException if the file cannot be read or holds an invalid peak line
     */
    public static Map<String, ObservedSpectrum> read(Path file, Pattern titlePattern, Set<String> wanted) throws IOException {
        Map<String, ObservedSpectrum> spectra = new LinkedHashMap<>();
        List<Double> mz = new ArrayList<>();
        List<Double> intensity = new ArrayList<>();
        String title = null;
        boolean inSpectrum = false;
        int lineNumber = 0;
        try (BufferedReader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            String line;
            while((line = reader.readLine()) != null){
                lineNumber++;
                line = line.trim();
                if(line.isEmpty() || line.startsWith("#")){
                    continue;
                }
                if(line.equals("BEGIN IONS")){
                    inSpectrum = true;
                    title = null;
                    mz.clear();
                    intensity.clear();
                }else if(line.equals("END IONS")){
                    if(inSpectrum && title != null){
                        String id = spectrumId(title, titlePattern);
                        if(wanted == null || wanted.contains(id)){
                            spectra.put(id, new ObservedSpectrum(id, Doubles.toArray(mz), Doubles.toArray(intensity)));
                        }
                    }
                    inSpectrum = false;
                }else if(inSpectrum){
                    if(line.startsWith("TITLE=")){
                        title = line.substring("TITLE=".length()).trim();
                    }else if(Character.isDigit(line.charAt(0))){
                        String[] d = line.split("\\s+");
                        try {
                            mz.add(Double.parseDouble(d[0]));
                            intensity.add(d.length > 1 ? Double.parseDouble(d[1]) : 0.0);
                        } catch (NumberFormatException e) {
                            throw new IOException("Invalid peak in " + file + " line " + lineNumber + ": " + line, e);
                        }
                    }
                }
            }
        }
        PLogger.getInstance().logger.info("Read " + spectra.size() + " spectra from " + file);
        return spectra;
    }

    public static Map<String, ObservedSpectrum> read(Path file) throws IOException {
        return read(file, DEFAULT_TITLE_PATTERN, null);
    }

    static String spectrumId(String title, Pattern titlePattern){
        Matcher m = titlePattern.matcher(title);
        if(m.find() && m.groupCount() >= 1 && m.group(1) != null){
            return m.group(1);
        }
        return title;
    }
}
