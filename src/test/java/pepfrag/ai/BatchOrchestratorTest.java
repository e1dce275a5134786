package pepfrag.ai;

import org.junit.Assert;
import org.junit.Test;
import pepfrag.dia.IonPrediction;
import pepfrag.error.ErrorKind;
import pepfrag.input.PeptideRecord;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

public class BatchOrchestratorTest {

    private static final String[] RESIDUES = {"A", "C", "D", "E", "F", "G", "H", "I", "K", "M", "N", "P", "Q", "R", "S", "T", "V", "W", "Y"};

    private static List<PeptideRecord> randomPeptides(int n){
        java.util.Random random = new java.util.Random(2024);
        List<PeptideRecord> peptides = new ArrayList<>(n);
        for(int i=0;i<n;i++){
            int len = 4 + random.nextInt(20);
            StringBuilder sb = new StringBuilder();
            for(int j=0;j<len;j++){
                sb.append(RESIDUES[random.nextInt(RESIDUES.length)]);
            }
            peptides.add(new PeptideRecord("pep" + i, sb.toString(), 2 + random.nextInt(3)));
        }
        return peptides;
    }

    @Test
    public void testResultsFollowInputOrder() throws Exception {
        List<PeptideRecord> peptides = Arrays.asList(
                new PeptideRecord("ok1", "ACDK", 2),
                new PeptideRecord("bad_residue", "AXDK", 2),
                new PeptideRecord("too_short", "ACD", 2),
                PeptideRecord.fromPeprec("ok2", "PEPMIDEK", "4|Oxidation", 3),
                new PeptideRecord("bad_charge", "ACDK", 0));
        BatchOrchestrator orchestrator = new BatchOrchestrator(ModelFixtures.predictor(ModelFixtures.registry()), 3);
        List<PeptideResult> results = orchestrator.run(peptides, "HCD", 2);
        Assert.assertEquals(peptides.size(), results.size());
        for(int i=0;i<peptides.size();i++){
            Assert.assertEquals(peptides.get(i).getId(), results.get(i).getId());
        }
        Assert.assertTrue(results.get(0).isOk());
        Assert.assertEquals(6, results.get(0).getSpectrum().size());
        Assert.assertEquals(ErrorKind.INVALID_RESIDUE, results.get(1).getError());
        Assert.assertEquals(ErrorKind.LENGTH, results.get(2).getError());
        Assert.assertTrue(results.get(3).isOk());
        Assert.assertEquals("4|Oxidation", results.get(3).getSpectrum().getModifications());
        Assert.assertEquals(ErrorKind.INVALID_CHARGE, results.get(4).getError());
        Assert.assertNull(results.get(1).getSpectrum());
    }

    @Test
    public void testChunkingDoesNotChangeResults() throws Exception {
        List<PeptideRecord> peptides = randomPeptides(200);
        SpectrumPredictor predictor = ModelFixtures.predictor(ModelFixtures.registry());
        List<PeptideResult> reference = new BatchOrchestrator(predictor, 1).run(peptides, "HCD", 1000);
        for(int chunkSize : new int[]{1, 7, 64}){
            List<PeptideResult> results = new BatchOrchestrator(predictor, 4, 2).run(peptides, "HCD", chunkSize);
            Assert.assertEquals(reference.size(), results.size());
            for(int i=0;i<results.size();i++){
                Assert.assertTrue(results.get(i).isOk());
                Assert.assertEquals(reference.get(i).getSpectrum(), results.get(i).getSpectrum());
            }
        }
    }

    @Test
    public void testUnsupportedMethod() throws Exception {
        List<PeptideRecord> peptides = Arrays.asList(new PeptideRecord("a", "ACDK", 2), new PeptideRecord("b", "AXDK", 2));
        List<PeptideResult> results = new BatchOrchestrator(ModelFixtures.predictor(ModelFixtures.registry()), 2).run(peptides, "XYZ", 10);
        Assert.assertEquals(ErrorKind.UNSUPPORTED_METHOD, results.get(0).getError());
        // validation comes first
        Assert.assertEquals(ErrorKind.INVALID_RESIDUE, results.get(1).getError());
    }

    @Test
    public void testMissingModel() throws Exception {
        List<PeptideResult> results = new BatchOrchestrator(ModelFixtures.predictor(ModelFixtures.registry()), 2)
                .run(Collections.singletonList(new PeptideRecord("a", "ACDK", 2)), "CID", 10);
        Assert.assertEquals(ErrorKind.MODEL_NOT_FOUND, results.get(0).getError());
    }

    @Test
    public void testCrashedChunkIsIsolated() throws Exception {
        // the b model dies on peptides of length 5
        ModelRegistry registry = ModelRegistry.builder()
                .register(new ModelFixtures.FunctionModel(FragmentationMethod.HCD, IonType.B, row -> {
                    if(row[0] == 5){
                        throw new IllegalStateException("boom");
                    }
                    return 1.0;
                }))
                .register(new ModelFixtures.FunctionModel(FragmentationMethod.HCD, IonType.Y, row -> 2.0))
                .build();
        List<PeptideRecord> peptides = Arrays.asList(
                new PeptideRecord("p0", "ACDK", 2),
                new PeptideRecord("p1", "ACDK", 2),
                new PeptideRecord("p2", "ACDEK", 2),
                new PeptideRecord("p3", "ACDK", 2),
                new PeptideRecord("p4", "ACDK", 2));
        List<PeptideResult> results = new BatchOrchestrator(ModelFixtures.predictor(registry), 2).run(peptides, "HCD", 2);
        Assert.assertTrue(results.get(0).isOk());
        Assert.assertTrue(results.get(1).isOk());
        Assert.assertEquals(ErrorKind.WORKER_FAILURE, results.get(2).getError());
        Assert.assertEquals(ErrorKind.WORKER_FAILURE, results.get(3).getError());
        Assert.assertEquals("p3", results.get(3).getId());
        Assert.assertTrue(results.get(4).isOk());
    }

    @Test
    public void testCancel() throws Exception {
        CountDownLatch started = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        ModelRegistry registry = ModelRegistry.builder()
                .register(new ModelFixtures.FunctionModel(FragmentationMethod.HCD, IonType.B, row -> {
                    started.countDown();
                    try {
                        release.await();
                    } catch (InterruptedException e) {
                        throw new IllegalStateException(e);
                    }
                    return 1.0;
                }))
                .register(new ModelFixtures.FunctionModel(FragmentationMethod.HCD, IonType.Y, row -> 1.0))
                .build();
        List<PeptideRecord> peptides = new ArrayList<>();
        for(int i=0;i<5;i++){
            peptides.add(new PeptideRecord("p" + i, "ACDK", 2));
        }
        BatchOrchestrator orchestrator = new BatchOrchestrator(ModelFixtures.predictor(registry), 1, 1);
        ExecutorService runner = Executors.newSingleThreadExecutor();
        try {
            Future<List<PeptideResult>> future = runner.submit(() -> orchestrator.run(peptides, "HCD", 1));
            Assert.assertTrue(started.await(10, TimeUnit.SECONDS));
            orchestrator.cancel();
            Assert.assertTrue(orchestrator.isCancelled());
            release.countDown();
            List<PeptideResult> results = future.get(10, TimeUnit.SECONDS);
            Assert.assertEquals(5, results.size());
            // the running peptide completes, nothing else is started
            Assert.assertTrue(results.get(0).isOk());
            for(int i=1;i<5;i++){
                Assert.assertEquals("p" + i, results.get(i).getId());
                Assert.assertEquals(ErrorKind.CANCELLED, results.get(i).getError());
            }
        } finally {
            runner.shutdownNow();
        }
    }

    @Test
    public void testEmptyInput() throws Exception {
        List<PeptideResult> results = new BatchOrchestrator(ModelFixtures.predictor(ModelFixtures.registry()), 2)
                .run(Collections.emptyList(), "HCD", 10);
        Assert.assertTrue(results.isEmpty());
    }

    @Test(expected = IllegalArgumentException.class)
    public void testInvalidChunkSize() throws Exception {
        new BatchOrchestrator(ModelFixtures.predictor(ModelFixtures.registry()), 2).run(Collections.emptyList(), "HCD", 0);
    }

    private static ModelRegistry constantRegistry(FragmentationMethod method) throws Exception {
        ModelRegistry.Builder builder = ModelRegistry.builder();
        for(IonType ionType : method.getIonTypes()){
            double score = ionType.ordinal() + 1.0;
            builder.register(new ModelFixtures.FunctionModel(method, ionType, row -> score));
        }
        return builder.build();
    }

    @Test
    public void testDoublyChargedIonsOnLongPeptides() throws Exception {
        List<PeptideRecord> peptides = Arrays.asList(
                new PeptideRecord("short_ok", "ACDKEFGHK", 2),
                new PeptideRecord("len22", "ACDEFGHIKMNPQRSTVWYACK", 3),
                new PeptideRecord("bad", "AXDK", 2));
        List<PeptideResult> results = new BatchOrchestrator(ModelFixtures.predictor(constantRegistry(FragmentationMethod.HCD_CH2)), 2)
                .run(peptides, "HCDch2", 10);
        Assert.assertTrue(results.get(0).isOk());
        Assert.assertTrue(results.get(1).isOk());
        Assert.assertEquals(ErrorKind.INVALID_RESIDUE, results.get(2).getError());
        Assert.assertEquals(FragmentationMethod.HCD_CH2.getIonCount(9), results.get(0).getSpectrum().size());
        Assert.assertEquals(84, results.get(1).getSpectrum().size());
        List<IonPrediction> ions = results.get(1).getSpectrum().getIons();
        Assert.assertEquals("b1", ions.get(0).getLabel());
        Assert.assertEquals("b1^2", ions.get(1).getLabel());
        Assert.assertEquals("b21^2", ions.get(41).getLabel());
        Assert.assertEquals("y1", ions.get(42).getLabel());
        Assert.assertEquals("y21^2", ions.get(83).getLabel());
        Assert.assertEquals(IonType.B2.ordinal() + 1.0, ions.get(1).getIntensity(), 0.0);
        Assert.assertEquals(IonType.Y.ordinal() + 1.0, ions.get(42).getIntensity(), 0.0);
    }

    @Test
    public void testEtdBatch() throws Exception {
        List<PeptideRecord> peptides = randomPeptides(30);
        List<PeptideResult> results = new BatchOrchestrator(ModelFixtures.predictor(constantRegistry(FragmentationMethod.ETD)), 3)
                .run(peptides, "ETD", 4);
        for(int i=0;i<peptides.size();i++){
            PeptideResult r = results.get(i);
            Assert.assertTrue(r.isOk());
            int n = peptides.get(i).getSequence().length();
            List<IonPrediction> ions = r.getSpectrum().getIons();
            Assert.assertEquals(FragmentationMethod.ETD.getIonCount(n), ions.size());
            Assert.assertEquals("b1", ions.get(0).getLabel());
            Assert.assertEquals("c1", ions.get(n - 1).getLabel());
            Assert.assertEquals("y1", ions.get(2 * (n - 1)).getLabel());
            Assert.assertEquals("z" + (n - 1), ions.get(ions.size() - 1).getLabel());
        }
    }

    @Test
    public void testCancelBeforeRun() throws Exception {
        List<PeptideRecord> peptides = randomPeptides(6);
        BatchOrchestrator orchestrator = new BatchOrchestrator(ModelFixtures.predictor(ModelFixtures.registry()), 2);
        orchestrator.cancel();
        Assert.assertTrue(orchestrator.isCancelled());
        List<PeptideResult> cancelled = orchestrator.run(peptides, "HCD", 2);
        Assert.assertEquals(6, cancelled.size());
        for(PeptideResult r : cancelled){
            Assert.assertEquals(ErrorKind.CANCELLED, r.getError());
        }
        // the request applies to one run only
        Assert.assertFalse(orchestrator.isCancelled());
        for(PeptideResult r : orchestrator.run(peptides, "HCD", 2)){
            Assert.assertTrue(r.isOk());
        }
    }
}
