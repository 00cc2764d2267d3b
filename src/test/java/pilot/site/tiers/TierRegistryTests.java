package pilot.site.tiers;

import java.io.File;
import java.net.URISyntaxException;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import pilot.config.ConfigProperties;
import pilot.site.QueueData;

class TierRegistryTests {

	static QueueCatalog catalog() {
		try {
			return new QueueCatalog(new FileQueueCatalogSource(new File(TierRegistryTests.class.getResource("/queuedata.json").toURI())));
		}
		catch (final URISyntaxException e) {
			throw new IllegalStateException(e);
		}
	}

	@Test
	void testIsTier1() {
		final TierRegistry tiers = new TierRegistry(catalog());

		Assertions.assertTrue(tiers.isTier1("CERN-PROD"));
		Assertions.assertTrue(tiers.isTier1("BNL_PROD-condor"));
		Assertions.assertFalse(tiers.isTier1("SITE_A"));
		Assertions.assertFalse(tiers.isTier1("CERN-PROD_DATADISK"));
		Assertions.assertFalse(tiers.isTier1(""));
		Assertions.assertFalse(tiers.isTier1(null));
	}

	@Test
	void testTier2AndTier3() {
		final TierRegistry tiers = new TierRegistry(catalog());

		final QueueData local = new QueueData("T3_QUEUE", Collections.singletonMap(QueueData.DDM, "local"));
		final QueueData siteA = new QueueData("ANALY_SITE_A", Collections.singletonMap(QueueData.DDM, "SITE_A_DATADISK"));

		Assertions.assertTrue(TierRegistry.isTier3(local));
		Assertions.assertFalse(TierRegistry.isTier3(siteA));

		Assertions.assertTrue(tiers.isTier2("SITE_A", siteA));
		Assertions.assertFalse(tiers.isTier2("T3_SITE", local));
		Assertions.assertFalse(tiers.isTier2("CERN-PROD", siteA));
	}

	@Test
	void testResolveTier1Queue() {
		final TierRegistry tiers = new TierRegistry(catalog());

		Assertions.assertEquals("CERN-PROD", tiers.getTier1Name("CERN"));
		Assertions.assertEquals("CERN-PROD_QUEUE", tiers.resolveTier1Queue("CERN", null));
		Assertions.assertEquals("IN2P3-CC_QUEUE", tiers.resolveTier1Queue("FR", "ATLASDATADISK"));
	}

	@Test
	void testWorldCloud() {
		final TierRegistry tiers = new TierRegistry(catalog());

		Assertions.assertEquals("IN2P3-CC_QUEUE", tiers.resolveTier1Queue(TierRegistry.WORLD, "dst:IN2P3-CC_SCRATCHDISK"));
		Assertions.assertEquals("CERN-PROD_QUEUE", tiers.resolveTier1Queue(TierRegistry.WORLD, "dst:SITE_A_DATADISK"));

		Assertions.assertEquals("", tiers.resolveTier1Queue(TierRegistry.WORLD, "ATLASDATADISK"));
		Assertions.assertEquals("", tiers.resolveTier1Queue(TierRegistry.WORLD, null));
		Assertions.assertEquals("", tiers.resolveTier1Queue(TierRegistry.WORLD, "dst:NOWHERE_DATADISK"));
	}

	@Test
	void testBackupAndMissingQueues() {
		final TierRegistry tiers = new TierRegistry(catalog());

		// BNL_PROD has no queue in the catalog
		Assertions.assertEquals("BNL_PROD-condor", tiers.resolveTier1Queue("US", null));

		// neither a queue nor a backup
		Assertions.assertEquals("", tiers.resolveTier1Queue("ND", null));

		Assertions.assertEquals("", tiers.resolveTier1Queue("XX", null));
		Assertions.assertEquals("", tiers.getTier1Name("XX"));
		Assertions.assertNull(tiers.getTier1(null));
	}

	@Test
	void testFromConfiguration() {
		final Map<String, String> entries = new HashMap<>();
		entries.put("US", "BNL_PROD, BNL_PROD-condor");
		entries.put("CERN", "CERN-PROD");
		entries.put("EMPTY", "");

		final TierRegistry tiers = TierRegistry.fromConfiguration(new ConfigProperties(entries), catalog());

		Assertions.assertEquals(2, tiers.getCloudList().size());
		Assertions.assertEquals("BNL_PROD-condor", tiers.getTier1("US").backupQueue);
		Assertions.assertFalse(tiers.isTier1("TRIUMF"));

		// nothing configured, the builtin table is used
		Assertions.assertEquals(13, TierRegistry.fromConfiguration(new ConfigProperties(), catalog()).getCloudList().size());
	}

	@Test
	void testCatalogLoadRetried() {
		final AtomicInteger calls = new AtomicInteger();

		final QueueCatalogSource delegate = new FileQueueCatalogSource(new File("does-not-exist.json"));
		final QueueCatalog real = catalog();

		final QueueCatalog flaky = new QueueCatalog(() -> {
			if (calls.incrementAndGet() == 1)
				return delegate.load();

			return new FileQueueCatalogSource(new File(TierRegistryTests.class.getResource("/queuedata.json").getPath())).load();
		});

		final TierRegistry tiers = new TierRegistry(flaky);

		Assertions.assertEquals("", tiers.resolveTier1Queue("CERN", null));
		Assertions.assertEquals("CERN-PROD_QUEUE", tiers.resolveTier1Queue("CERN", null));
		Assertions.assertEquals(2, calls.get());

		// loaded once, then kept
		tiers.resolveTier1Queue("FR", null);
		Assertions.assertEquals(2, calls.get());

		Assertions.assertEquals(real.getQueues().keySet(), flaky.getQueues().keySet());
	}

	@Test
	void testQueueData() {
		final QueueCatalog c = catalog();

		final QueueData cern = c.getQueueData("CERN-PROD_QUEUE");

		Assertions.assertEquals("/castor/cern.ch/grid/atlas/rucio", cern.gets(QueueData.SEPATH));
		Assertions.assertEquals(Arrays.asList("CERN-PROD_DATADISK", "CERN-PROD_SCRATCHDISK"), cern.getList(QueueData.DDM));

		Assertions.assertEquals(Arrays.asList("IN2P3-CC_DATADISK", "IN2P3-CC_SCRATCHDISK"), c.getQueueData("IN2P3-CC_QUEUE").getList(QueueData.DDM));
		Assertions.assertEquals(Arrays.asList("IN2P3-CC_DATADISK", "IN2P3-CC_SCRATCHDISK"), c.get("IN2P3-CC_QUEUE").ddm);

		Assertions.assertNull(c.getQueueData("UNKNOWN"));
		Assertions.assertEquals("FR", c.getCorrespondingCloud("IN2P3-CC_DATADISK"));
		Assertions.assertEquals("", c.getQueueForResource("BNL_PROD"));
	}
}
