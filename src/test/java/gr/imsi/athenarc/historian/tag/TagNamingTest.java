package gr.imsi.athenarc.historian.tag;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;

import gr.imsi.athenarc.historian.domain.Tag;

public class TagNamingTest {

    private final TagNaming naming = new TagNaming("MELSRV01.", ".F_CV", ".csv");

    @Test
    public void testAddsPrefixAndSuffix() {
        Tag tag = naming.canonicalize(" BoilerTemp ");
        assertEquals("MELSRV01.BoilerTemp.F_CV", tag.getName());
        assertEquals("BoilerTemp", tag.getDisplayName());
    }

    @Test
    public void testKeepsExistingDecoration() {
        assertEquals("MELSRV01.BoilerTemp.F_CV", naming.canonicalize("MELSRV01.BoilerTemp.F_CV").getName());
        Tag lowerCasePrefix = naming.canonicalize("melsrv01.BoilerTemp");
        assertEquals("melsrv01.BoilerTemp.F_CV", lowerCasePrefix.getName());
        assertEquals("BoilerTemp", lowerCasePrefix.getDisplayName());
    }

    @Test
    public void testStripsFileSuffix() {
        assertEquals("MELSRV01.BoilerTemp.F_CV", naming.canonicalize("BoilerTemp.F_CV.csv").getName());
        assertEquals("MELSRV01.BoilerTemp.F_CV", naming.canonicalize("BoilerTemp.CSV").getName());
    }

    @Test
    public void testRejectsBlankTags() {
        assertThrows(IllegalArgumentException.class, () -> naming.canonicalize("   "));
        assertThrows(IllegalArgumentException.class, () -> naming.canonicalize(".csv"));
        assertThrows(IllegalArgumentException.class, () -> naming.canonicalize(null));
    }

    @Test
    public void testUndecoratedLeavesNamesAlone() {
        Tag tag = TagNaming.undecorated().canonicalize("X");
        assertEquals("X", tag.getName());
        assertEquals("X", tag.getDisplayName());
    }
}
