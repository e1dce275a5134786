package pepfrag.input;

import org.apache.commons.io.FileUtils;
import org.junit.Assert;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;
import pepfrag.dia.ObservedSpectrum;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Collections;
import java.util.Map;
import java.util.regex.Pattern;

public class MgfReaderTest {

    private static final String MGF = "BEGIN IONS\n"
            + "TITLE=run1.100.100.2 spec_a\n"
            + "PEPMASS=300.15 1000.0\n"
            + "CHARGE=2+\n"
            + "100.0 10.0\n"
            + "200.0\t20.0\n"
            + "END IONS\n"
            + "\n"
            + "BEGIN IONS\n"
            + "TITLE=run1.101.101.3 spec_b\n"
            + "CHARGE=3+\n"
            + "150.5 5.0\n"
            + "END IONS\n";

    @Rule
    public TemporaryFolder folder = new TemporaryFolder();

    private File write(String content) throws IOException {
        File file = folder.newFile("spectra.mgf");
        FileUtils.writeStringToFile(file, content, StandardCharsets.UTF_8);
        return file;
    }

    @Test
    public void testRead() throws IOException {
        Map<String, ObservedSpectrum> spectra = MgfReader.read(write(MGF).toPath());
        Assert.assertEquals(2, spectra.size());
        ObservedSpectrum a = spectra.get("run1.100.100.2 spec_a");
        Assert.assertEquals(2, a.size());
        Assert.assertEquals(200.0, a.getMz(1), 0.0);
        Assert.assertEquals(20.0, a.getIntensity(1), 0.0);
    }

    @Test
    public void testTitlePatternAndFilter() throws IOException {
        Map<String, ObservedSpectrum> spectra = MgfReader.read(write(MGF).toPath(), Pattern.compile(" (spec_\\w+)$"),
                Collections.singleton("spec_b"));
        Assert.assertEquals(1, spectra.size());
        Assert.assertEquals(150.5, spectra.get("spec_b").getMz(0), 0.0);
        Assert.assertEquals("spec_b", MgfReader.spectrumId("run1 spec_b", Pattern.compile(" (spec_\\w+)$")));
        // no match keeps the title
        Assert.assertEquals("other", MgfReader.spectrumId("other", Pattern.compile(" (spec_\\w+)$")));
    }

    @Test(expected = IOException.class)
    public void testInvalidPeak() throws IOException {
        MgfReader.read(write("BEGIN IONS\nTITLE=x\n100.0 abc\nEND IONS\n").toPath());
    }
}
