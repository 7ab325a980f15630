/* This code is part of LSX. It is distributed under the GNU General
 * Public License, version 2 (or at your option any later version). See
 * http://www.gnu.org/ for further details of the GPL. */
package lsx.support;

/**
 * Hexadecimal conversions, mostly for digests and test vectors.
 *
 * @author syoung
 */
public class HexUtil {
	private HexUtil() {
	}

	/**
	 * Converts a byte array into a string of lower case hex chars.
	 *
	 * @param bs
	 *            A byte array
	 * @param off
	 *            The index of the first byte to read
	 * @param length
	 *            The number of bytes to read.
	 * @return the string of hex chars.
	 */
	public static String bytesToHex(byte[] bs, int off, int length) {
		if (off < 0 || length < 0 || bs.length < off+length)
			throw new IllegalArgumentException();
		StringBuilder sb = new StringBuilder(length * 2);
		for (int i = off; i < (off + length); i++) {
			sb.append(Character.forDigit((bs[i] >>> 4) & 0xf, 16));
			sb.append(Character.forDigit(bs[i] & 0xf, 16));
		}
		return sb.toString();
	}

	public static String bytesToHex(byte[] bs) {
		return bytesToHex(bs, 0, bs.length);
	}

	/**
	 * Converts a String of hex characters into an array of bytes. An odd
	 * length string is treated as if it had a leading zero.
	 *
	 * @param s
	 *            A string of hex characters (upper case or lower).
	 */
	public static byte[] hexToBytes(String s) throws NumberFormatException {
		if ((s.length() % 2) != 0) {
			s = '0' + s;
		}
		int slen = s.length();
		byte[] out = new byte[slen / 2];
		byte b1, b2;
		for (int i = 0; i < slen; i += 2) {
			b1 = (byte) Character.digit(s.charAt(i), 16);
			b2 = (byte) Character.digit(s.charAt(i + 1), 16);
			if ((b1 < 0) || (b2 < 0)) {
				throw new NumberFormatException("Not a hex string: " + s);
			}
			out[i / 2] = (byte) (b1 << 4 | b2);
		}
		return out;
	}
}
