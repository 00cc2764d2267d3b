package pilot.security;

import java.io.IOException;

/**
 * Where key pairs come from
 */
public interface KeyPairSource {
	/**
	 * @param privateKeyName
	 * @param publicKeyName
	 * @return the pair, never <code>null</code>
	 * @throws IOException if the pair cannot be retrieved
	 */
	KeyPair getKeyPair(String privateKeyName, String publicKeyName) throws IOException;
}
