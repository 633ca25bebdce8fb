package org.winslowlab.ultraseq.utils;

import org.winslowlab.ultraseq.testutils.BaseTest;
import org.testng.Assert;
import org.testng.annotations.DataProvider;
import org.testng.annotations.Test;

public final class BaseUtilsUnitTest extends BaseTest {

    @DataProvider(name = "reverseComplements")
    public Object[][] reverseComplements() {
        return new Object[][]{
                {"", ""},
                {"A", "T"},
                {"ACGT", "ACGT"},
                {"AACGTN", "NACGTT"},
                {"acgTN", "NAcgt"},
                {"GATTACA", "TGTAATC"},
        };
    }

    @Test(dataProvider = "reverseComplements")
    public void testSimpleReverseComplement(final String bases, final String expected) {
        Assert.assertEquals(BaseUtils.simpleReverseComplement(bases), expected);
    }

    @Test(dataProvider = "reverseComplements")
    public void testReverseComplementIsAnInvolution(final String bases, final String ignored) {
        Assert.assertEquals(BaseUtils.simpleReverseComplement(BaseUtils.simpleReverseComplement(bases)), bases);
    }

    @Test
    public void testUnknownCharactersAreKept() {
        Assert.assertEquals(BaseUtils.simpleComplement('-'), '-');
        Assert.assertEquals(BaseUtils.simpleReverseComplement("A-C"), "G-T");
    }

    @Test(expectedExceptions = IllegalArgumentException.class)
    public void testNullBases() {
        BaseUtils.simpleReverseComplement(null);
    }
}
