package pepfrag.ai;

import org.junit.Assert;
import org.junit.Test;
import pepfrag.error.PredictionException;
import pepfrag.error.UnsupportedMethodException;
import pepfrag.input.ModificationTable;
import pepfrag.input.PeptideRecord;
import pepfrag.input.PeptideResolver;
import pepfrag.input.ResidueTable;
import pepfrag.input.ResolvedPeptide;

import java.util.Arrays;

public class PeptideEncoderTest {

    private static final double A = 71.037114;
    private static final double C = 103.00919;
    private static final double D = 115.026943;
    private static final double K = 128.094963;

    private final PeptideResolver resolver = new PeptideResolver(ResidueTable.getDefault(), ModificationTable.loadDefault());
    private final PeptideEncoder encoder = new PeptideEncoder();
    private final FeatureSchema schema = FeatureSchema.V1;

    private ResolvedPeptide resolve(String sequence, String mods, int charge) throws PredictionException {
        return resolver.resolve(PeptideRecord.fromPeprec(sequence, sequence, mods, charge));
    }

    @Test
    public void testRowLayout() throws PredictionException {
        FeatureMatrix m = encoder.encode(resolve("ACDK", "-", 2), "HCD");
        Assert.assertEquals(6, m.rowCount());
        Assert.assertEquals(62, m.columnCount());
        Assert.assertEquals(schema.getFeatureCount(), m.columnCount());
        IonType[] types = {IonType.B, IonType.B, IonType.B, IonType.Y, IonType.Y, IonType.Y};
        int[] numbers = {1, 2, 3, 1, 2, 3};
        for(int r=0;r<6;r++){
            Assert.assertEquals(types[r], m.ionTypeAt(r));
            Assert.assertEquals(numbers[r], m.ionNumberAt(r));
        }
        Assert.assertEquals(Arrays.asList(IonType.B, IonType.Y), m.getIonTypes());
        Assert.assertArrayEquals(new int[]{3, 4, 5}, m.rowsOf(IonType.Y));
    }

    @Test
    public void testIonMz() throws PredictionException {
        FeatureMatrix m = encoder.encode(resolve("ACDK", "-", 2), FragmentationMethod.HCD);
        double p = ResidueTable.PROTON_MASS;
        Assert.assertEquals(A + p, m.mzAt(0), 1e-6);
        Assert.assertEquals(A + C + D + p, m.mzAt(2), 1e-6);
        Assert.assertEquals(K + ResidueTable.H2O_MASS + p, m.mzAt(3), 1e-6);
        Assert.assertEquals(D + K + ResidueTable.H2O_MASS + p, m.mzAt(4), 1e-6);
        Assert.assertEquals(m.mzAt(0), m.get(0, schema.indexOf("fragment_mz")), 0.0);

        FeatureMatrix etd = encoder.encode(resolve("ACDK", "-", 2), FragmentationMethod.ETD);
        Assert.assertEquals(12, etd.rowCount());
        Assert.assertEquals(Arrays.asList(IonType.B, IonType.Y, IonType.C, IonType.Z), etd.getIonTypes());
        Assert.assertEquals(IonType.C, etd.ionTypeAt(6));
        Assert.assertEquals(A + ResidueTable.NH3_MASS + p, etd.mzAt(6), 1e-6);
        Assert.assertEquals(IonType.Z, etd.ionTypeAt(9));
        Assert.assertEquals(K + ResidueTable.H2O_MASS - ResidueTable.NH2_MASS + p, etd.mzAt(9), 1e-6);

        FeatureMatrix ch2 = encoder.encode(resolve("ACDK", "-", 3), FragmentationMethod.HCD_CH2);
        Assert.assertEquals(12, ch2.rowCount());
        Assert.assertEquals(IonType.B2, ch2.ionTypeAt(7));
        Assert.assertEquals(2, ch2.ionNumberAt(7));
        Assert.assertEquals((A + C + 2 * p) / 2, ch2.mzAt(7), 1e-6);
    }

    @Test
    public void testIonMzMatchesMatrix() throws PredictionException {
        ResolvedPeptide peptide = resolve("PEPMIDEK", "4|Oxidation", 2);
        FeatureMatrix m = encoder.encode(peptide, FragmentationMethod.ETD);
        for(int r=0;r<m.rowCount();r++){
            Assert.assertEquals(m.mzAt(r), encoder.ionMz(peptide, m.ionTypeAt(r), m.ionNumberAt(r)), 0.0);
        }
    }

    @Test
    public void testPeptideAndIonFeatures() throws PredictionException {
        ResolvedPeptide peptide = resolve("ACDK", "-", 2);
        FeatureMatrix m = encoder.encode(peptide, FragmentationMethod.HCD);
        Assert.assertEquals(4, m.get(0, schema.indexOf("peptide_length")), 0.0);
        Assert.assertEquals(2, m.get(0, schema.indexOf("precursor_charge")), 0.0);
        Assert.assertEquals(peptide.getPrecursorMz(), m.get(5, schema.indexOf("precursor_mz")), 0.0);
        // y1 cleaves after residue 3
        Assert.assertEquals(1, m.get(3, schema.indexOf("ion_number")), 0.0);
        Assert.assertEquals(3, m.get(3, schema.indexOf("cleavage_index")), 0.0);
        Assert.assertEquals(K, m.get(3, schema.indexOf("fragment_mass")), 1e-6);
        // b1: prefix A, suffix CDK
        Assert.assertEquals(A, m.get(0, schema.indexOf("prefix_mass")), 1e-6);
        Assert.assertEquals(C + D + K, m.get(0, schema.indexOf("suffix_mass")), 1e-6);
        Assert.assertEquals(0, m.get(0, schema.indexOf("basic_prefix")), 0.0);
        Assert.assertEquals(1, m.get(0, schema.indexOf("basic_suffix")), 0.0);
        Assert.assertEquals(1.8, m.get(0, schema.indexOf("hydrophobicity_prefix_mean")), 1e-9);
        Assert.assertEquals(A, m.get(0, schema.indexOf("nterm_mass")), 1e-6);
        Assert.assertEquals(K, m.get(0, schema.indexOf("cterm_mass")), 1e-6);
    }

    @Test
    public void testWindowIsZeroPaddedOutsideThePeptide() throws PredictionException {
        FeatureMatrix m = encoder.encode(resolve("ACDK", "-", 2), FragmentationMethod.HCD);
        // b1: window covers positions 0..3
        Assert.assertEquals(0.0, m.get(0, schema.indexOf("w-1_mass")), 0.0);
        Assert.assertEquals(0.0, m.get(0, schema.indexOf("w-1_hydrophobicity")), 0.0);
        Assert.assertEquals(A, m.get(0, schema.indexOf("w0_mass")), 1e-6);
        Assert.assertEquals(C, m.get(0, schema.indexOf("w+1_mass")), 1e-6);
        Assert.assertEquals(D, m.get(0, schema.indexOf("w+2_mass")), 1e-6);
        // y1: window covers positions 2..5
        Assert.assertEquals(K, m.get(3, schema.indexOf("w+1_mass")), 1e-6);
        Assert.assertEquals(0.0, m.get(3, schema.indexOf("w+2_mass")), 0.0);
    }

    @Test
    public void testModificationChangesMassAndWindow() throws PredictionException {
        FeatureMatrix plain = encoder.encode(resolve("AMDK", "-", 2), FragmentationMethod.HCD);
        FeatureMatrix ox = encoder.encode(resolve("AMDK", "2|Oxidation", 2), FragmentationMethod.HCD);
        Assert.assertEquals(15.994915, ox.get(1, schema.indexOf("w0_mod_delta")), 1e-9);
        Assert.assertEquals(15.994915, ox.get(0, schema.indexOf("w+1_mod_delta")), 1e-9);
        Assert.assertEquals(0.0, plain.get(1, schema.indexOf("w0_mod_delta")), 0.0);
        // b1 does not contain M, b2 does
        Assert.assertEquals(plain.mzAt(0), ox.mzAt(0), 1e-9);
        Assert.assertEquals(plain.mzAt(1) + 15.994915, ox.mzAt(1), 1e-6);
        // y3 contains M
        Assert.assertEquals(plain.mzAt(5) + 15.994915, ox.mzAt(5), 1e-6);
        Assert.assertFalse(plain.contentEquals(ox));
    }

    @Test
    public void testDeterministic() throws PredictionException {
        ResolvedPeptide peptide = resolve("PEPTIDEKR", "0|Acetyl", 3);
        FeatureMatrix a = encoder.encode(peptide, FragmentationMethod.ETD);
        FeatureMatrix b = new PeptideEncoder().encode(peptide, FragmentationMethod.ETD);
        Assert.assertTrue(a.contentEquals(b));
    }

    @Test
    public void testMethodNames() throws UnsupportedMethodException {
        Assert.assertEquals(FragmentationMethod.HCD, FragmentationMethod.fromName("hcd"));
        Assert.assertEquals(FragmentationMethod.HCD, FragmentationMethod.fromName("HCD2021"));
        Assert.assertEquals(FragmentationMethod.TMT, FragmentationMethod.fromName("TMT-HCD"));
        Assert.assertEquals(FragmentationMethod.IMMUNO_HCD, FragmentationMethod.fromName("Immuno-HCD"));
        Assert.assertEquals(4, FragmentationMethod.CID_CH2.getIonTypes().size());
    }

    @Test(expected = UnsupportedMethodException.class)
    public void testUnsupportedMethod() throws PredictionException {
        encoder.encode(resolve("ACDK", "-", 2), "XYZ");
    }
}
