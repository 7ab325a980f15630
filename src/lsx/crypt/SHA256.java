/* This code is part of LSX. It is distributed under the GNU General
 * Public License, version 2 (or at your option any later version). See
 * http://www.gnu.org/ for further details of the GPL. */
package lsx.crypt;

import lsx.support.HexUtil;

/**
 * One-shot SHA-256. Use this when the whole message is already in one array;
 * otherwise feed a {@link BufferedSHA256}, or a {@link RawSHA256} if the data
 * arrives in whole 64-byte blocks anyway.
 */
public final class SHA256 {

	private SHA256() {
	}

	/** @return The SHA-256 digest of <b>data</b>. */
	public static byte[] hash(byte[] data) {
		return new RawSHA256().finish(data);
	}

	/** @return The SHA-256 digest of <b>length</b> bytes of <b>data</b> from <b>offset</b>. */
	public static byte[] hash(byte[] data, int offset, int length) {
		return new RawSHA256().finish(data, offset, length);
	}

	/** @return The SHA-256 digest of <b>data</b> as lower case hex. */
	public static String hashHex(byte[] data) {
		return HexUtil.bytesToHex(hash(data));
	}

	public static int getDigestLength() {
		return RawSHA256.HASH_SIZE;
	}

	public static int getBlockLength() {
		return RawSHA256.BLOCK_SIZE;
	}
}
