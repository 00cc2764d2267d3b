package pilot.config;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

class ConfigUtilsTests {

	@Test
	void testBuiltinFiles() {
		Assertions.assertEquals("BNL_PROD, BNL_PROD-condor", ConfigUtils.getConfiguration("tiers").gets("US"));
		Assertions.assertEquals("CERN-PROD", ConfigUtils.getConfiguration("TIERS").gets("CERN"));
		Assertions.assertFalse(ConfigUtils.getConfiguration("overrides").keySet().isEmpty());
	}

	@Test
	void testMissingFile() {
		Assertions.assertTrue(ConfigUtils.getConfiguration("no-such-file").keySet().isEmpty());
	}

	@Test
	void testSystemPropertiesAreVisible() {
		// system properties are read at load time, java.version is always there
		Assertions.assertFalse(ConfigUtils.getConfig().gets("java.version").isEmpty());
		Assertions.assertTrue(ConfigUtils.getConfig().getl("mover.timeout", -1) > 0);
	}
}
