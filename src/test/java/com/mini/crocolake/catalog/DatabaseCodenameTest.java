package com.mini.crocolake.catalog;

import org.junit.jupiter.api.Test;

import java.nio.file.Paths;

import static org.junit.jupiter.api.Assertions.*;

public class DatabaseCodenameTest {
    
    @Test
    public void testArgoCodenames() {
        assertEquals("1003_BGC_ARGO-QC",
            DatabaseCodename.of(LakeDatabase.ARGO, LakeDatabase.Domain.BGC, true, false).getCodename());
        assertEquals("1011_PHY_ARGO-CLOUD",
            DatabaseCodename.of(LakeDatabase.ARGO, LakeDatabase.Domain.PHY, false, false).getCodename());
    }
    
    @Test
    public void testCrocoLakeCodename() {
        assertEquals("0007_PHY_CROCOLAKE-QC-MERGED",
            DatabaseCodename.of("crocolake", "phy", true).getCodename());
        assertThrows(IllegalArgumentException.class,
            () -> DatabaseCodename.of(LakeDatabase.CROCOLAKE, LakeDatabase.Domain.BGC, false, false));
    }
    
    @Test
    public void testDevCodenames() {
        DatabaseCodename dev = DatabaseCodename.of(LakeDatabase.ARGO, LakeDatabase.Domain.BGC, true, true);
        assertEquals("1002_BGC_ARGO-QC-DEV", dev.getCodename());
        assertTrue(dev.isDev());
        
        assertEquals("1010_PHY_ARGO-CLOUD-DEV",
            DatabaseCodename.of(LakeDatabase.ARGO, LakeDatabase.Domain.PHY, false, true).getCodename());
        assertEquals("0006_BGC_CROCOLAKE-QC-MERGED-DEV",
            DatabaseCodename.of(LakeDatabase.CROCOLAKE, LakeDatabase.Domain.BGC, true, true).getCodename());
    }
    
    @Test
    public void testLocalPath() {
        DatabaseCodename codename = DatabaseCodename.of("ARGO", "BGC", true);
        assertEquals(Paths.get("data", "1003_BGC_ARGO-QC"), codename.localPath(Paths.get("data")));
        assertFalse(codename.isDev());
    }
    
    @Test
    public void testInvalidNames() {
        assertThrows(IllegalArgumentException.class, () -> DatabaseCodename.of("GLODAP", "PHY", true));
        assertThrows(IllegalArgumentException.class, () -> DatabaseCodename.of("ARGO", "CHEM", true));
    }
}
