package pepfrag.input;

import org.junit.Assert;
import org.junit.Test;
import pepfrag.error.ErrorKind;
import pepfrag.error.InvalidChargeException;
import pepfrag.error.InvalidModificationException;
import pepfrag.error.InvalidResidueException;
import pepfrag.error.PeptideLengthException;
import pepfrag.error.PredictionException;

import java.util.Arrays;

public class PeptideResolverTest {

    private final PeptideResolver resolver = new PeptideResolver(ResidueTable.getDefault(), ModificationTable.loadDefault());

    @Test
    public void testResolveUnmodified() throws PredictionException {
        ResolvedPeptide peptide = resolver.resolve(new PeptideRecord("p1", "ACDEK", 2));
        Assert.assertEquals(5, peptide.length());
        Assert.assertEquals("ACDEK", peptide.getSequence());
        Assert.assertFalse(peptide.isModified());
        Assert.assertEquals("-", peptide.getModificationString());
        double mass = ResidueTable.H2O_MASS + 71.037114 + 103.00919 + 115.026943 + 129.042593 + 128.094963;
        Assert.assertEquals(mass, peptide.getMass(), 1e-6);
        Assert.assertEquals((mass + 2 * ResidueTable.PROTON_MASS) / 2, peptide.getPrecursorMz(), 1e-6);
    }

    @Test
    public void testLeucineIsEncodedAsIsoleucine() throws PredictionException {
        ResolvedPeptide l = resolver.resolve(new PeptideRecord("l", "PEPLIDE", 2));
        ResolvedPeptide i = resolver.resolve(new PeptideRecord("i", "PEPIIDE", 2));
        Assert.assertArrayEquals(i.getResidues(), l.getResidues());
        Assert.assertEquals(i.getMass(), l.getMass(), 0.0);
    }

    @Test
    public void testModifications() throws PredictionException {
        PeptideRecord record = PeptideRecord.fromPeprec("p", "PEPMIDE", "0|Acetyl|4|Oxidation", 2);
        ResolvedPeptide peptide = resolver.resolve(record);
        Assert.assertEquals("Acetyl", peptide.modificationAt(0).getName());
        Assert.assertEquals(15.994915, peptide.modMassAt(4), 1e-9);
        Assert.assertEquals(0.0, peptide.modMassAt(3), 0.0);
        Assert.assertEquals("0|Acetyl|4|Oxidation", peptide.getModificationString());
        ResolvedPeptide plain = resolver.resolve(new PeptideRecord("q", "PEPMIDE", 2));
        Assert.assertEquals(plain.getMass() + 42.010565 + 15.994915, peptide.getMass(), 1e-6);
    }

    @Test
    public void testFixedModificationIsApplied() throws PredictionException {
        ModificationTable table = ModificationTable.builder()
                .addDefaults()
                .add("Carbamidomethyl,57.021464,fix,C")
                .build();
        PeptideResolver r = new PeptideResolver(ResidueTable.getDefault(), table);
        ResolvedPeptide peptide = r.resolve(new PeptideRecord("c", "ACDCK", 2));
        Assert.assertEquals("2|Carbamidomethyl|4|Carbamidomethyl", peptide.getModificationString());
    }

    @Test
    public void testLength(){
        PredictionException e = assertRejected(new PeptideRecord("short", "ACD", 2), PeptideLengthException.class);
        Assert.assertEquals(ErrorKind.LENGTH, e.getKind());
        char[] seq = new char[101];
        Arrays.fill(seq, 'A');
        assertRejected(new PeptideRecord("long", new String(seq), 2), PeptideLengthException.class);
        assertRejected(new PeptideRecord("empty", "", 2), PeptideLengthException.class);

        PeptideResolver strict = new PeptideResolver(ResidueTable.getDefault(), ModificationTable.loadDefault(), 7, 30);
        try {
            strict.resolve(new PeptideRecord("p", "PEPTIDE", 2));
        } catch (PredictionException ex) {
            Assert.fail("Length 7 is inside 7..30: " + ex.getMessage());
        }
    }

    @Test
    public void testInvalidResidue(){
        PredictionException e = assertRejected(new PeptideRecord("x", "AXDEK", 2), InvalidResidueException.class);
        Assert.assertEquals(ErrorKind.INVALID_RESIDUE, e.getKind());
        Assert.assertTrue(e.getMessage().contains("'X'"));
        assertRejected(new PeptideRecord("b", "ABDEK", 2), InvalidResidueException.class);
    }

    @Test
    public void testInvalidCharge(){
        PredictionException e = assertRejected(new PeptideRecord("z", "ACDEK", 0), InvalidChargeException.class);
        Assert.assertEquals(ErrorKind.INVALID_CHARGE, e.getKind());
    }

    @Test
    public void testInvalidModifications(){
        // unknown name
        assertRejected(PeptideRecord.fromPeprec("a", "ACDEK", "1|Foo", 2), InvalidModificationException.class);
        // wrong residue
        assertRejected(PeptideRecord.fromPeprec("b", "ACDEK", "2|Oxidation", 2), InvalidModificationException.class);
        // position out of range
        assertRejected(PeptideRecord.fromPeprec("c", "ACDEK", "7|Amidated", 2), InvalidModificationException.class);
        assertRejected(PeptideRecord.fromPeprec("c10", "ACDK", "10|Oxidation", 2), InvalidModificationException.class);
        // N-terminal modification on a residue
        assertRejected(PeptideRecord.fromPeprec("d", "ACDEK", "1|Acetyl", 2), InvalidModificationException.class);
        // two modifications on one residue
        PredictionException e = assertRejected(PeptideRecord.fromPeprec("e", "ACDEK", "5|TMT6plexK|5|AcetylK", 2), InvalidModificationException.class);
        Assert.assertEquals(ErrorKind.INVALID_MODIFICATION, e.getKind());
    }

    @Test
    public void testCTerminalModification() throws PredictionException {
        ResolvedPeptide peptide = resolver.resolve(PeptideRecord.fromPeprec("a", "ACDEK", "6|Amidated", 2));
        Assert.assertEquals(-0.984016, peptide.modMassAt(6), 1e-9);
    }

    private PredictionException assertRejected(PeptideRecord record, Class<? extends PredictionException> expected){
        try {
            resolver.resolve(record);
        } catch (PredictionException e) {
            Assert.assertEquals(expected, e.getClass());
            return e;
        }
        Assert.fail("Expected " + expected.getSimpleName() + " for " + record);
        return null;
    }
}
