/* This code is part of LSX. It is distributed under the GNU General
 * Public License, version 2 (or at your option any later version). See
 * http://www.gnu.org/ for further details of the GPL. */
package lsx.crypt.ciphers;

import static org.junit.Assert.*;

import java.util.Arrays;
import java.util.Random;

import org.bouncycastle.crypto.engines.TwofishEngine;
import org.bouncycastle.crypto.params.KeyParameter;
import org.junit.Test;

import lsx.crypt.UnsupportedCipherException;
import lsx.support.HexUtil;

public class TwofishTest {
	// key, plaintext, ciphertext
	private static final String[][] vectors = {
		{ "00000000000000000000000000000000",
		  "00000000000000000000000000000000",
		  "9F589F5CF6122C32B6BFEC2F2AE8C35A" },
		{ "00000000000000000000000000000000",
		  "9F589F5CF6122C32B6BFEC2F2AE8C35A",
		  "D491DB16E7B1C39E86CB086B789F5419" },
		{ "9F589F5CF6122C32B6BFEC2F2AE8C35A",
		  "D491DB16E7B1C39E86CB086B789F5419",
		  "019F9809DE1711858FAAC3A3BA20FBC3" },
		{ "000000000000000000000000000000000000000000000000",
		  "00000000000000000000000000000000",
		  "EFA71F788965BD4453F860178FC19101" },
		{ "0123456789ABCDEFFEDCBA98765432100011223344556677",
		  "00000000000000000000000000000000",
		  "CFD1D2E5A9BE9CDF501F13B892BD2248" },
		{ "0000000000000000000000000000000000000000000000000000000000000000",
		  "00000000000000000000000000000000",
		  "57FF739D4DC92C1BD7FC01700CC8216F" },
		{ "0123456789ABCDEFFEDCBA987654321000112233445566778899AABBCCDDEEFF",
		  "00000000000000000000000000000000",
		  "37527BE0052334B89F0CFCCAE87CFA20" }
	};

	@Test
	public void testKnownAnswers() {
		for (String[] v : vectors) {
			byte[] key = HexUtil.hexToBytes(v[0]);
			byte[] pt = HexUtil.hexToBytes(v[1]);
			byte[] ct = HexUtil.hexToBytes(v[2]);
			Twofish tf = Twofish.forKey(key);
			assertArrayEquals("key " + v[0], ct, tf.encrypt(pt));
			assertArrayEquals("key " + v[0], pt, tf.decrypt(ct));
		}
	}

	@Test
	public void testFactories() throws UnsupportedCipherException {
		assertEquals(128, Twofish.new128(new byte[16]).getKeySize());
		assertEquals(192, Twofish.new192(new byte[24]).getKeySize());
		assertEquals(256, Twofish.new256(new byte[32]).getKeySize());
		Twofish tf = new Twofish(192, new byte[24]);
		assertEquals(192, tf.getKeySize());
		assertEquals(128, tf.getBlockSize());
		assertArrayEquals(HexUtil.hexToBytes("EFA71F788965BD4453F860178FC19101"), tf.encrypt(new byte[16]));
	}

	@Test
	public void testWrongKeyLengths() {
		int[] lengths = { 0, 8, 15, 17, 23, 25, 31, 33, 64 };
		for (int len : lengths) {
			try {
				Twofish.forKey(new byte[len]);
				fail("Accepted a " + len + "-byte key");
			} catch (IllegalArgumentException e) {
				// Expected.
			}
		}
		try {
			Twofish.new128(new byte[24]);
			fail();
		} catch (IllegalArgumentException e) {
			// Expected.
		}
		try {
			Twofish.new256(new byte[16]);
			fail();
		} catch (IllegalArgumentException e) {
			// Expected.
		}
	}

	@Test
	public void testUnsupportedKeySize() throws UnsupportedCipherException {
		try {
			new Twofish(64, new byte[8]);
			fail();
		} catch (UnsupportedCipherException e) {
			// Expected.
		}
		try {
			new Twofish(128, new byte[32]);
			fail();
		} catch (IllegalArgumentException e) {
			// Expected.
		}
	}

	@Test
	public void testMatchesBouncyCastle() {
		Random r = new Random(1234);
		int[] keySizes = { 16, 24, 32 };
		for (int keySize : keySizes) {
			for (int i = 0; i < 50; i++) {
				byte[] key = new byte[keySize];
				byte[] block = new byte[16];
				r.nextBytes(key);
				r.nextBytes(block);

				TwofishEngine engine = new TwofishEngine();
				engine.init(true, new KeyParameter(key));
				byte[] expected = new byte[16];
				engine.processBlock(block, 0, expected, 0);

				Twofish tf = Twofish.forKey(key);
				assertArrayEquals(expected, tf.encrypt(block));
				assertArrayEquals(block, tf.decrypt(expected));
			}
		}
	}

	@Test
	public void testRoundTrip() {
		Random r = new Random(5);
		for (int i = 0; i < 100; i++) {
			byte[] key = new byte[16 + 8 * (i % 3)];
			byte[] block = new byte[16];
			r.nextBytes(key);
			r.nextBytes(block);
			Twofish tf = Twofish.forKey(key);
			assertArrayEquals(block, tf.decrypt(tf.encrypt(block)));
		}
	}

	@Test
	public void testInPlaceAndOffsets() {
		byte[] key = HexUtil.hexToBytes("0123456789ABCDEFFEDCBA987654321000112233445566778899AABBCCDDEEFF");
		Twofish tf = Twofish.new256(key);
		byte[] block = new byte[16];
		tf.encipher(block, block);
		assertArrayEquals(HexUtil.hexToBytes("37527BE0052334B89F0CFCCAE87CFA20"), block);
		tf.decipher(block, block);
		assertArrayEquals(new byte[16], block);

		byte[] buf = new byte[40];
		tf.encipher(buf, 3, buf, 20);
		assertArrayEquals(HexUtil.hexToBytes("37527BE0052334B89F0CFCCAE87CFA20"), Arrays.copyOfRange(buf, 20, 36));
		tf.decipher(buf, 20, buf, 20);
		assertArrayEquals(new byte[16], Arrays.copyOfRange(buf, 20, 36));
	}

	@Test
	public void testBadBlocks() {
		Twofish tf = Twofish.new128(new byte[16]);
		try {
			tf.encrypt(new byte[15]);
			fail();
		} catch (IllegalArgumentException e) {
			// Expected.
		}
		try {
			tf.encipher(new byte[16], new byte[17]);
			fail();
		} catch (IllegalArgumentException e) {
			// Expected.
		}
		try {
			tf.decipher(new byte[20], 5, new byte[16], 0);
			fail();
		} catch (IllegalArgumentException e) {
			// Expected.
		}
	}

	@Test
	public void testDeterministicKeySchedule() {
		byte[] key = new byte[24];
		new Random(77).nextBytes(key);
		Twofish a = Twofish.forKey(key);
		Twofish b = Twofish.forKey(key.clone());
		assertArrayEquals(a.subKeys(), b.subKeys());
		int[][] sa = a.sBoxes();
		int[][] sb = b.sBoxes();
		for (int i = 0; i < 4; i++)
			assertArrayEquals(sa[i], sb[i]);

		key[0] ^= 1;
		assertFalse(Arrays.equals(a.subKeys(), Twofish.forKey(key).subKeys()));
	}

	@Test
	public void testSelfTest() {
		assertTrue(Twofish.selfTest());
	}

	@Test
	public void testToStringHidesKey() {
		assertEquals("Twofish[256-bit key]", Twofish.new256(new byte[32]).toString());
	}
}
