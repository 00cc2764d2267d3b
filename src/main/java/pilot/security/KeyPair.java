package pilot.security;

/**
 * A public / private key pair as handed out by the PanDA server. Both keys are <code>null</code> when the pair could
 * not be retrieved.
 */
public final class KeyPair {
	/**
	 * The pair returned on failures
	 */
	public static final KeyPair EMPTY = new KeyPair(null, null);

	/**
	 * Public key
	 */
	public final String publicKey;

	/**
	 * Private key
	 */
	public final String privateKey;

	/**
	 * @param publicKey
	 * @param privateKey
	 */
	public KeyPair(final String publicKey, final String privateKey) {
		this.publicKey = publicKey;
		this.privateKey = privateKey;
	}

	/**
	 * @return <code>true</code> if both keys are known
	 */
	public boolean isValid() {
		return publicKey != null && privateKey != null;
	}

	@Override
	public String toString() {
		return "KeyPair(" + (isValid() ? "valid" : "empty") + ")";
	}
}
