package pilot.security;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicInteger;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

class SecurityKeyCacheTests {

	@Test
	void testRetrievedOnce() throws Exception {
		final AtomicInteger calls = new AtomicInteger();

		final SecurityKeyCache cache = new SecurityKeyCache((priv, pub) -> {
			calls.incrementAndGet();
			return new KeyPair("public:" + pub, "private:" + priv);
		});

		final ExecutorService executor = Executors.newFixedThreadPool(8);

		try {
			final List<Future<KeyPair>> futures = new ArrayList<>();

			for (int i = 0; i < 32; i++)
				futures.add(executor.submit(() -> cache.get("privkey", "pubkey")));

			for (final Future<KeyPair> f : futures)
				Assertions.assertEquals("private:privkey", f.get().privateKey);
		}
		finally {
			executor.shutdownNow();
		}

		Assertions.assertEquals(1, calls.get());
		Assertions.assertEquals(1, cache.size());

		cache.get("otherpriv", "pubkey");

		Assertions.assertEquals(2, calls.get());
		Assertions.assertEquals(2, cache.size());
	}

	@Test
	void testFailuresAreNotCached() {
		final AtomicInteger calls = new AtomicInteger();

		final SecurityKeyCache cache = new SecurityKeyCache((priv, pub) -> {
			switch (calls.incrementAndGet()) {
				case 1:
					throw new IOException("PanDA server unreachable");
				case 2:
					return new KeyPair(null, "private");
				default:
					return new KeyPair("public", "private");
			}
		});

		Assertions.assertSame(KeyPair.EMPTY, cache.get("privkey", "pubkey"));
		Assertions.assertEquals(0, cache.size());

		Assertions.assertFalse(cache.get("privkey", "pubkey").isValid());
		Assertions.assertEquals(0, cache.size());

		Assertions.assertTrue(cache.get("privkey", "pubkey").isValid());
		Assertions.assertTrue(cache.get("privkey", "pubkey").isValid());
		Assertions.assertEquals(3, calls.get());
		Assertions.assertEquals(1, cache.size());
	}

	@Test
	void testParseReply() {
		final Map<String, String> reply = PandaKeyPairSource.parseReply("StatusCode=0&publicKey=ssh-rsa+AAAA%2Fxyz&privateKey=-----BEGIN%0Aabc\n");

		Assertions.assertEquals("0", reply.get("StatusCode"));
		Assertions.assertEquals("ssh-rsa AAAA/xyz", reply.get("publicKey"));
		Assertions.assertEquals("-----BEGIN\nabc", reply.get("privateKey"));

		Assertions.assertTrue(PandaKeyPairSource.parseReply("garbage").isEmpty());
	}
}
