package edu.duke.cs.cmapalign.control;

import static org.junit.jupiter.api.Assertions.*;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

public class TestParamSet {

    @TempDir
    Path dir;

    @Test
    public void testDefaults() {
        ParamSet params = ParamSet.withDefaults();
        assertEquals(6.0, params.getDouble("ContactThreshold"));
        assertEquals(1000, params.getInt("maxseqlen"));
        assertEquals(2, params.getInt("GENERATEDCONTACTS"));
        assertFalse(params.getBool("UseCellGrid"));
        assertTrue(Double.isNaN(params.getDouble("MinIdentity")));

        ContactMapSettings settings = new ContactMapSettings(params);
        assertEquals(6.0, settings.contactThreshold);
        assertEquals(1000, settings.maxSeqLen);
        assertEquals(2, settings.generatedContacts);
        assertEquals(1, settings.numThreads);
        assertFalse(settings.abortOnFailure);
    }

    @Test
    public void testOverrideFromFile() throws IOException {
        Path cfg = dir.resolve("run.cfg");
        Files.writeString(cfg, "# my run\n"
                + "ContactThreshold 8.0\n"
                + "\n"
                + "% old-style comment\n"
                + "NumThreads   4\n"
                + "StructureDir /data/some dir/with spaces\n");

        ParamSet params = ParamSet.withDefaults();
        params.addParamsFromFile(cfg.toString());

        assertEquals(8.0, params.getDouble("CONTACTTHRESHOLD"));
        assertEquals(4, params.getInt("NumThreads"));
        assertEquals(1000, params.getInt("MaxSeqLen"));//untouched default
        assertEquals("/data/some dir/with spaces", params.getValue("structuredir"));
    }

    @Test
    public void testMissingAndDefaults() {
        ParamSet params = new ParamSet();
        assertFalse(params.contains("Foo"));
        assertThrows(ConfigurationException.class, () -> params.getValue("Foo"));
        assertEquals(3, params.getInt("Foo", 3));
        assertEquals(1.5, params.getDouble("Foo", 1.5));
        assertTrue(params.getBool("Foo", true));
        assertEquals("bar", params.getValue("Foo", "bar"));
    }

    @Test
    public void testBadValues() {
        ParamSet params = new ParamSet();
        params.setValue("NumThreads", "four");
        params.setValue("ContactThreshold", "close");
        params.setValue("UseCellGrid", "maybe");
        assertThrows(ConfigurationException.class, () -> params.getInt("NumThreads"));
        assertThrows(ConfigurationException.class, () -> params.getDouble("ContactThreshold"));
        assertThrows(ConfigurationException.class, () -> params.getBool("UseCellGrid"));
    }

    @Test
    public void testLineWithoutValue() throws IOException {
        Path cfg = dir.resolve("broken.cfg");
        Files.writeString(cfg, "ContactThreshold\n");
        ParamSet params = new ParamSet();
        assertThrows(ConfigurationException.class, () -> params.addParamsFromFile(cfg.toString()));
        assertThrows(ConfigurationException.class,
                () -> params.addParamsFromFile(dir.resolve("missing.cfg").toString()));
    }

    @Test
    public void testSettingsValidation() {
        ParamSet params = ParamSet.withDefaults();
        params.setValue("GeneratedContacts", "-1");
        assertThrows(ConfigurationException.class, () -> new ContactMapSettings(params));

        ParamSet params2 = ParamSet.withDefaults();
        params2.setValue("ContactThreshold", "0");
        assertThrows(ConfigurationException.class, () -> new ContactMapSettings(params2));

        ParamSet params3 = ParamSet.withDefaults();
        params3.setValue("NumThreads", "0");
        assertThrows(ConfigurationException.class, () -> new ContactMapSettings(params3));

        assertThrows(ConfigurationException.class, () -> new ContactMapSettings(6.0, -5, 2));
    }
}
