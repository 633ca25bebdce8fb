package org.winslowlab.ultraseq.tools.dualguide;

import com.google.common.collect.ImmutableSet;
import org.winslowlab.ultraseq.exceptions.UserException;
import org.winslowlab.ultraseq.testutils.BaseTest;
import org.testng.Assert;
import org.testng.annotations.Test;

import java.nio.file.Path;

public final class GuideReferenceUnitTest extends BaseTest {

    @Test
    public void testLoad() {
        final Path path = writeLines(createTempPath("reference", ".csv"),
                "Name,Position,gRNA_complete",
                "sgA,G1,AAAA",
                "sgB,G1,CCCC",
                "sgC,G2,GGGG",
                "sgD,G3,TTTT",
                "sgE,G2,AAAA");
        final GuideReference reference = GuideReference.load(path, "Position", "gRNA_complete", "G1", "G2");
        Assert.assertEquals(reference.getPosition1Guides(), ImmutableSet.of("AAAA", "CCCC"));
        Assert.assertEquals(reference.getPosition2Guides(), ImmutableSet.of("GGGG", "AAAA"));
    }

    @Test
    public void testClassify() {
        final GuideReference reference = new GuideReference(ImmutableSet.of("AAAA", "CCCC"), ImmutableSet.of("GGGG"));
        Assert.assertEquals(reference.classify("AAAA", "GGGG"), ReadClass.EXPECTED);
        Assert.assertEquals(reference.classify("CCCC", "GGGG"), ReadClass.EXPECTED);
        Assert.assertEquals(reference.classify("GGGG", "AAAA"), ReadClass.UNEXPECTED);
        Assert.assertEquals(reference.classify("AAAA", "TTTT"), ReadClass.UNEXPECTED);
        Assert.assertEquals(reference.classify("aaaa", "GGGG"), ReadClass.UNEXPECTED);
    }

    @Test
    public void testEmptyPositionMakesEverythingUnexpected() {
        final Path path = writeLines(createTempPath("reference", ".csv"), "Position,gRNA_complete", "G1,AAAA");
        final GuideReference reference = GuideReference.load(path, "Position", "gRNA_complete", "G1", "G2");
        Assert.assertTrue(reference.getPosition2Guides().isEmpty());
        Assert.assertEquals(reference.classify("AAAA", "AAAA"), ReadClass.UNEXPECTED);
    }

    @Test(expectedExceptions = UserException.BadInput.class)
    public void testMissingColumn() {
        final Path path = writeLines(createTempPath("reference", ".csv"), "Position,sequence", "G1,AAAA");
        GuideReference.load(path, "Position", "gRNA_complete", "G1", "G2");
    }

    @Test(expectedExceptions = UserException.CouldNotReadInputFile.class)
    public void testMissingFile() {
        GuideReference.load(createTempDir("reference").toPath().resolve("missing.csv"), "Position", "gRNA_complete", "G1", "G2");
    }
}
