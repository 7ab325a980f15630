/* This code is part of LSX. It is distributed under the GNU General
 * Public License, version 2 (or at your option any later version). See
 * http://www.gnu.org/ for further details of the GPL. */
package lsx.crypt;

import static org.junit.Assert.*;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Random;

import org.bouncycastle.crypto.digests.SHA256Digest;
import org.bouncycastle.util.encoders.Hex;
import org.junit.Test;

public class BufferedSHA256Test {
	private static final String LOREM =
		"Lorem ipsum dolor sit amet, consectetur adipiscing elit, sed do eiusmod tempor "
		+ "incididunt ut labore et dolore magna aliqua. Ut enim ad minim veniam, quis nostrud "
		+ "exercitation ullamco laboris nisi ut aliquip ex ea commodo consequat. Duis aute irure "
		+ "dolor in reprehenderit in voluptate velit esse cillum dolore eu fugiat nulla pariatur.";

	private static byte[] bouncyCastle(byte[] data) {
		SHA256Digest d = new SHA256Digest();
		d.update(data, 0, data.length);
		byte[] out = new byte[32];
		d.doFinal(out, 0);
		return out;
	}

	@Test
	public void testChunkingDoesNotMatter() {
		byte[] data = LOREM.getBytes(StandardCharsets.UTF_8);
		byte[] expected = bouncyCastle(data);
		for (int chunk = 1; chunk <= 130; chunk++) {
			BufferedSHA256 sha = new BufferedSHA256();
			for (int off = 0; off < data.length; off += chunk)
				sha.update(data, off, Math.min(chunk, data.length - off));
			assertArrayEquals("chunk size " + chunk, expected, sha.finish());
		}
	}

	@Test
	public void testRandomChunks() {
		Random r = new Random(42);
		for (int round = 0; round < 20; round++) {
			byte[] data = new byte[r.nextInt(2000)];
			r.nextBytes(data);
			BufferedSHA256 sha = new BufferedSHA256();
			int off = 0;
			while (off < data.length) {
				int len = Math.min(r.nextInt(200), data.length - off);
				sha.update(data, off, len);
				off += len;
				assertEquals(off, sha.getByteCount());
				assertTrue(sha.getBufferedBytes() < 64);
			}
			assertArrayEquals(bouncyCastle(data), sha.finish());
		}
	}

	@Test
	public void testSingleBytes() {
		byte[] data = new byte[200];
		new Random(7).nextBytes(data);
		BufferedSHA256 sha = new BufferedSHA256();
		for (byte b : data)
			sha.update(b);
		assertEquals(200, sha.getByteCount());
		assertEquals(200 % 64, sha.getBufferedBytes());
		assertArrayEquals(bouncyCastle(data), sha.finish());
	}

	@Test
	public void testFinishWithTrailingData() {
		byte[] data = LOREM.getBytes(StandardCharsets.UTF_8);
		BufferedSHA256 sha = new BufferedSHA256();
		sha.update(data, 0, 100);
		assertArrayEquals(bouncyCastle(data), sha.finish(data, 100, data.length - 100));
	}

	@Test
	public void testMillionA() {
		byte[] thousand = new byte[1000];
		Arrays.fill(thousand, (byte) 'a');
		BufferedSHA256 sha = new BufferedSHA256();
		for (int i = 0; i < 1000; i++)
			sha.update(thousand);
		assertArrayEquals(Hex.decode("cdc76e5c9914fb9281a1c7e284d73e67f1809a48a497200e046d39ccc7112cd0"),
				sha.finish());
	}

	@Test
	public void testEmptyUpdateIsNoOp() {
		BufferedSHA256 sha = new BufferedSHA256();
		sha.update(new byte[] { 1, 2, 3 });
		sha.update(new byte[0]);
		assertEquals(3, sha.getByteCount());
		assertEquals(3, sha.getBufferedBytes());
		assertArrayEquals(bouncyCastle(new byte[] { 1, 2, 3 }), sha.finish());
	}

	@Test
	public void testFinishedStateRejectsEverything() {
		BufferedSHA256 sha = new BufferedSHA256();
		sha.finish();
		assertTrue(sha.isFinished());
		try {
			sha.update((byte) 1);
			fail();
		} catch (IllegalStateException e) {
			// Expected.
		}
		try {
			sha.update(new byte[0]);
			fail();
		} catch (IllegalStateException e) {
			// Expected.
		}
		try {
			sha.finish();
			fail();
		} catch (IllegalStateException e) {
			// Expected.
		}
		try {
			sha.finish(new byte[0]);
			fail();
		} catch (IllegalStateException e) {
			// Expected.
		}
	}

	@Test
	public void testFinishChecksRangeEvenWhenEmpty() {
		BufferedSHA256 sha = new BufferedSHA256();
		sha.update(new byte[] { 1, 2, 3 });
		try {
			sha.finish(null, 0, 0);
			fail("Accepted a null array");
		} catch (NullPointerException e) {
			// Expected.
		}
		try {
			sha.finish(new byte[4], 99, 0);
			fail("Accepted an offset past the end");
		} catch (IllegalArgumentException e) {
			// Expected.
		}
		try {
			sha.finish(new byte[4], -1, 0);
			fail("Accepted a negative offset");
		} catch (IllegalArgumentException e) {
			// Expected.
		}
		assertFalse(sha.isFinished());
		assertEquals(3, sha.getByteCount());
		assertArrayEquals(bouncyCastle(new byte[] { 1, 2, 3 }), sha.finish(new byte[4], 4, 0));
	}

	@Test
	public void testCopyIsIndependent() {
		byte[] data = LOREM.getBytes(StandardCharsets.UTF_8);
		BufferedSHA256 sha = new BufferedSHA256();
		sha.update(data, 0, 70);
		BufferedSHA256 fork = sha.copy();
		fork.update(new byte[] { 9 });
		sha.update(data, 70, data.length - 70);
		assertArrayEquals(bouncyCastle(data), sha.finish());

		byte[] forked = Arrays.copyOf(data, 71);
		forked[70] = 9;
		assertArrayEquals(bouncyCastle(forked), fork.finish());
	}

	@Test
	public void testLimitIsRecoverable() {
		BufferedSHA256 sha = new BufferedSHA256(RawSHA256.withByteCount(RawSHA256.MAX_BYTES - 64));
		sha.update(new byte[60]);
		try {
			sha.update(new byte[4]);
			fail("Should refuse to reach 2^61 bytes");
		} catch (HashLimitExceededException e) {
			// Expected.
		}
		assertEquals(60, sha.getBufferedBytes());
		sha.update(new byte[3]);
		try {
			sha.update((byte) 0);
			fail();
		} catch (HashLimitExceededException e) {
			// Expected.
		}
		assertEquals(RawSHA256.MAX_BYTES - 1, sha.getByteCount());
		assertEquals(32, sha.finish().length);
	}

	@Test
	public void testToStringHidesState() {
		BufferedSHA256 sha = new BufferedSHA256();
		sha.update(new byte[] { 1, 2, 3 });
		assertEquals("BufferedSHA256 { ... }", sha.toString());
	}
}
