package com.alibaba.partgen.common.collation;

import com.alibaba.partgen.common.exception.PartGenRuntimeException;
import org.junit.Assert;
import org.junit.Test;

public class CollationHandlersTest {

    @Test
    public void testBinaryCollations() {
        CollationHandler c = CollationHandlers.getHandler("C");
        Assert.assertTrue(c.compare("B", "a") < 0);
        Assert.assertEquals(0, c.compare("abc", "abc"));
        Assert.assertSame(CollationHandlers.DEFAULT_HANDLER, CollationHandlers.getHandler(null));
        Assert.assertSame(CollationHandlers.DEFAULT_HANDLER, CollationHandlers.getHandler("default"));
        Assert.assertTrue(CollationHandlers.isDefault(null));
        Assert.assertFalse(CollationHandlers.isDefault("C"));
    }

    @Test
    public void testLocaleCollation() {
        CollationHandler en = CollationHandlers.getHandler("en_US");
        Assert.assertTrue(en instanceof LocaleCollationHandler);
        // linguistic order puts lower case a before upper case B
        Assert.assertTrue(en.compare("a", "B") < 0);
        Assert.assertTrue(en.compare("a", "A") != 0);

        CollationHandler ci = CollationHandlers.getHandler("en_US_ci");
        Assert.assertFalse(ci.isCaseSensitive());
        Assert.assertEquals(0, ci.compare("abc", "ABC"));
    }

    @Test
    public void testNulls() {
        CollationHandler c = CollationHandlers.getHandler("POSIX");
        Assert.assertTrue(c.compare(null, "a") < 0);
        Assert.assertTrue(c.compare("a", null) > 0);
        Assert.assertEquals(0, c.compare(null, null));
    }

    @Test(expected = PartGenRuntimeException.class)
    public void testUnknownCollation() {
        CollationHandlers.getHandler("no such collation");
    }
}
