package org.winslowlab.ultraseq.utils;

import org.winslowlab.ultraseq.testutils.BaseTest;
import org.testng.Assert;
import org.testng.annotations.DataProvider;
import org.testng.annotations.Test;

import java.util.Locale;

public final class UtilsUnitTest extends BaseTest {

    @DataProvider(name = "ratios")
    public Object[][] ratios() {
        return new Object[][]{
                {1, 2, "0.500"},
                {2, 3, "0.667"},
                {5, 5, "1.000"},
                {0, 0, "0.000"},
                {3, 0, "0.000"},
        };
    }

    @Test(dataProvider = "ratios")
    public void testFormattedRatio(final long num, final long denom, final String expected) {
        Assert.assertEquals(Utils.formattedRatio(num, denom), expected);
    }

    @Test
    public void testFormattedRatioUsesDotWhateverTheDefaultLocale() {
        final Locale defaultLocale = Locale.getDefault();
        try {
            Locale.setDefault(Locale.GERMANY);
            Assert.assertEquals(Utils.formattedRatio(1, 2), "0.500");
        } finally {
            Locale.setDefault(defaultLocale);
        }
    }

    @Test
    public void testValidateArg() {
        Utils.validateArg(true, "never thrown");
        Assert.assertThrows(IllegalArgumentException.class, () -> Utils.validateArg(false, "thrown"));
        Assert.assertThrows(IllegalArgumentException.class, () -> Utils.nonEmpty("", "empty"));
        Assert.assertThrows(IllegalArgumentException.class, () -> Utils.nonNull(null));
    }
}
