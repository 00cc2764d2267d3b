package utils;

/**
 * Coarse categories of transfer outcomes
 */
public enum StatusType {
	/**
	 * All went fine
	 */
	OK,
	/**
	 * Site or queue configuration doesn't allow the operation
	 */
	CONFIGURATION_ERROR,
	/**
	 * File or its metadata cannot be retrieved
	 */
	FILE_INACCESSIBLE,
	/**
	 * The transfer tools reported a failure
	 */
	TRANSFER_ERROR,
	/**
	 * Code problems / exceptions etc
	 */
	INTERNAL_ERROR,
}
