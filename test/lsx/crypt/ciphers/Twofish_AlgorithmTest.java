/* This code is part of LSX. It is distributed under the GNU General
 * Public License, version 2 (or at your option any later version). See
 * http://www.gnu.org/ for further details of the GPL. */
package lsx.crypt.ciphers;

import static org.junit.Assert.*;

import java.security.InvalidKeyException;

import org.junit.Test;

public class Twofish_AlgorithmTest {

	/** Shift-and-add multiplication in GF(2^8) mod x^8+x^6+x^3+x^2+1. */
	private static int slowMul(int a, int b) {
		int p = 0;
		while (b != 0) {
			if ((b & 1) != 0)
				p ^= a;
			a <<= 1;
			if ((a & 0x100) != 0)
				a ^= 0x14D;
			b >>= 1;
		}
		return p;
	}

	@Test
	public void testLogTableMultiplication() {
		for (int a = 0; a < 256; a++)
			for (int b = 0; b < 256; b++)
				assertEquals(a + "*" + b, slowMul(a, b), Twofish_Algorithm.RS_Mul(a, b));
	}

	@Test
	public void testReedSolomon() {
		assertEquals(0, Twofish_Algorithm.RS_Encode(new byte[8], 0));
		// A single 1 in column 0 picks out the first column of the matrix.
		byte[] k = new byte[] { 1, 0, 0, 0, 0, 0, 0, 0 };
		assertEquals(0xA402A401, Twofish_Algorithm.RS_Encode(k, 0));
		// Last column of the matrix.
		k = new byte[] { 0, 0, 0, 0, 0, 0, 0, 1 };
		assertEquals(0x0319E59E, Twofish_Algorithm.RS_Encode(k, 0));
	}

	@Test
	public void testMakeKey() throws InvalidKeyException {
		Twofish_Algorithm.SessionKey key = Twofish_Algorithm.makeKey(new byte[32]);
		assertEquals(Twofish_Algorithm.SUBKEY_COUNT, key.subKeys.length);
		assertEquals(4, key.sBox.length);
		assertEquals(256, key.sBox[3].length);
	}

	@Test(expected = InvalidKeyException.class)
	public void testNullKey() throws InvalidKeyException {
		Twofish_Algorithm.makeKey(null);
	}

	@Test(expected = InvalidKeyException.class)
	public void testShortKey() throws InvalidKeyException {
		Twofish_Algorithm.makeKey(new byte[8]);
	}

	@Test
	public void testSelfTest() {
		assertTrue(Twofish_Algorithm.selfTest());
	}
}
