/* This code is part of LSX. It is distributed under the GNU General
 * Public License, version 2 (or at your option any later version). See
 * http://www.gnu.org/ for further details of the GPL. */
package lsx.crypt;

import java.util.Arrays;

import lsx.support.Logger;

/**
 * The SHA-256 compression engine, without a buffer. Data must be supplied in
 * whole 64-byte blocks to {@link #update(byte[], int, int)}; only the final
 * call, {@link #finish(byte[], int, int)}, may carry a partial block.
 * <p>
 * An instance is consumed by finishing it: every call afterwards throws
 * {@link IllegalStateException}. Use {@link #copy()} first to keep hashing a
 * common prefix. Not thread-safe.
 * <p>
 * See FIPS 180-4, section 6.2.
 */
public final class RawSHA256 {

	/** Size (in bytes) of a SHA-256 input block */
	public static final int BLOCK_SIZE = 64;
	/** Size (in bytes) of a SHA-256 digest */
	public static final int HASH_SIZE = 32;
	/** Accumulators refuse to reach this many bytes: the bit count must fit in 64 bits. */
	public static final long MAX_BYTES = 1L << 61;

	/** Room needed after the message for the 0x80 marker and the 64-bit length. */
	private static final int PAD_OVERHEAD = 9;

	private static final int[] K = {
		0x428a2f98, 0x71374491, 0xb5c0fbcf, 0xe9b5dba5, 0x3956c25b, 0x59f111f1,
		0x923f82a4, 0xab1c5ed5, 0xd807aa98, 0x12835b01, 0x243185be, 0x550c7dc3,
		0x72be5d74, 0x80deb1fe, 0x9bdc06a7, 0xc19bf174, 0xe49b69c1, 0xefbe4786,
		0x0fc19dc6, 0x240ca1cc, 0x2de92c6f, 0x4a7484aa, 0x5cb0a9dc, 0x76f988da,
		0x983e5152, 0xa831c66d, 0xb00327c8, 0xbf597fc7, 0xc6e00bf3, 0xd5a79147,
		0x06ca6351, 0x14292967, 0x27b70a85, 0x2e1b2138, 0x4d2c6dfc, 0x53380d13,
		0x650a7354, 0x766a0abb, 0x81c2c92e, 0x92722c85, 0xa2bfe8a1, 0xa81a664b,
		0xc24b8b70, 0xc76c51a3, 0xd192e819, 0xd6990624, 0xf40e3585, 0x106aa070,
		0x19a4c116, 0x1e376c08, 0x2748774c, 0x34b0bcb5, 0x391c0cb3, 0x4ed8aa4a,
		0x5b9cca4f, 0x682e6ff3, 0x748f82ee, 0x78a5636f, 0x84c87814, 0x8cc70208,
		0x90befffa, 0xa4506ceb, 0xbef9a3f7, 0xc67178f2
	};

	private static final int[] IV = {
		0x6a09e667, 0xbb67ae85, 0x3c6ef372, 0xa54ff53a,
		0x510e527f, 0x9b05688c, 0x1f83d9ab, 0x5be0cd19
	};

	private static volatile boolean logMINOR;
	static {
		Logger.registerClass(RawSHA256.class);
	}

	private final int[] h;
	private long byteCount;
	private boolean finished;

	/** Message schedule, reused for every block. */
	private final int[] w = new int[64];

	/** Start a new hash. */
	public RawSHA256() {
		this(IV.clone(), 0);
	}

	private RawSHA256(int[] h, long byteCount) {
		this.h = h;
		this.byteCount = byteCount;
	}

	/**
	 * Start a hash that claims <b>byteCount</b> bytes have already been
	 * absorbed. Only useful for exercising the 2^61-byte ceiling.
	 */
	static RawSHA256 withByteCount(long byteCount) {
		if (byteCount < 0 || byteCount >= MAX_BYTES || byteCount % BLOCK_SIZE != 0)
			throw new IllegalArgumentException("Bad byte count " + byteCount);
		return new RawSHA256(IV.clone(), byteCount);
	}

	/**
	 * Process whole blocks of data. Throws IllegalArgumentException if the
	 * input is not an exact multiple of {@link #BLOCK_SIZE}.
	 */
	public void update(byte[] data) {
		update(data, 0, data.length);
	}

	/**
	 * Process <b>length</b> bytes of <b>data</b> starting at <b>offset</b>.
	 * <b>length</b> must be a multiple of {@link #BLOCK_SIZE}; a zero length
	 * is a no-op.
	 * @throws HashLimitExceededException if the accumulator would reach
	 * {@link #MAX_BYTES}; nothing is absorbed in that case.
	 */
	public void update(byte[] data, int offset, int length) {
		checkNotFinished();
		checkRange(data, offset, length);
		if (length % BLOCK_SIZE != 0)
			throw new IllegalArgumentException("Raw SHA-256 input must be a multiple of "
					+ BLOCK_SIZE + " bytes, got " + length);
		long newCount = checkCapacity(length);
		for (int end = offset + length; offset < end; offset += BLOCK_SIZE)
			compress(data, offset);
		byteCount = newCount;
	}

	/** Finish a hash with no trailing data. */
	public byte[] finish() {
		return finish(new byte[0], 0, 0);
	}

	/**
	 * Process the remaining data and produce the digest. The input does
	 * <i>not</i> need to be a multiple of {@link #BLOCK_SIZE}. Consumes this
	 * accumulator.
	 */
	public byte[] finish(byte[] data) {
		return finish(data, 0, data.length);
	}

	public byte[] finish(byte[] data, int offset, int length) {
		checkNotFinished();
		checkRange(data, offset, length);
		long total = checkCapacity(length);
		if (length >= BLOCK_SIZE) {
			int whole = length - (length % BLOCK_SIZE);
			update(data, offset, whole);
			offset += whole;
			length -= whole;
		}

		byte[] pad = new byte[BLOCK_SIZE * 2];
		System.arraycopy(data, offset, pad, 0, length);
		pad[length] = (byte) 0x80;
		long bitLength = total << 3;
		if (length > BLOCK_SIZE - PAD_OVERHEAD) {
			putLong(bitLength, pad, BLOCK_SIZE * 2 - 8);
			compress(pad, 0);
			compress(pad, BLOCK_SIZE);
		} else {
			putLong(bitLength, pad, BLOCK_SIZE - 8);
			compress(pad, 0);
		}
		byteCount = total;
		finished = true;

		byte[] digest = new byte[HASH_SIZE];
		for (int i = 0; i < 8; i++) {
			int v = h[i];
			digest[i * 4] = (byte) (v >>> 24);
			digest[i * 4 + 1] = (byte) (v >>> 16);
			digest[i * 4 + 2] = (byte) (v >>> 8);
			digest[i * 4 + 3] = (byte) v;
		}
		Arrays.fill(h, 0);
		Arrays.fill(w, 0);
		if (logMINOR) Logger.minor(this, "Finished SHA-256 over " + total + " bytes");
		return digest;
	}

	/** @return A new accumulator with the same state; both may continue independently. */
	public RawSHA256 copy() {
		checkNotFinished();
		return new RawSHA256(h.clone(), byteCount);
	}

	/** @return The number of bytes absorbed so far. */
	public long getByteCount() {
		return byteCount;
	}

	public boolean isFinished() {
		return finished;
	}

	/**
	 * Check that <b>extra</b> more bytes stay below the ceiling.
	 * @return The byte count after absorbing them.
	 */
	long checkCapacity(long extra) {
		long newCount = byteCount + extra;
		if (newCount >= MAX_BYTES) {
			Logger.warning(this, "Refusing to hash past 2^61 bytes (have " + byteCount
					+ ", asked for " + extra + ')');
			throw new HashLimitExceededException(byteCount, extra);
		}
		return newCount;
	}

	void checkNotFinished() {
		if (finished)
			throw new IllegalStateException("SHA-256 state already finished");
	}

	static void checkRange(byte[] data, int offset, int length) {
		if (data == null)
			throw new NullPointerException();
		if (offset < 0 || length < 0 || offset > data.length - length)
			throw new IllegalArgumentException("Bad range: offset " + offset + ", length "
					+ length + ", array length " + data.length);
	}

	/** Perform a single round of SHA-256 over the block at <b>off</b>. */
	private void compress(byte[] in, int off) {
		for (int n = 0; n < 16; n++, off += 4) {
			w[n] = (in[off] & 0xFF) << 24 |
			       (in[off + 1] & 0xFF) << 16 |
			       (in[off + 2] & 0xFF) << 8 |
			       (in[off + 3] & 0xFF);
		}
		for (int n = 16; n < 64; n++) {
			int x = w[n - 15];
			int y = w[n - 2];
			int s0 = Integer.rotateRight(x, 7) ^ Integer.rotateRight(x, 18) ^ (x >>> 3);
			int s1 = Integer.rotateRight(y, 17) ^ Integer.rotateRight(y, 19) ^ (y >>> 10);
			w[n] = w[n - 16] + s0 + w[n - 7] + s1;
		}

		int a = h[0];
		int b = h[1];
		int c = h[2];
		int d = h[3];
		int e = h[4];
		int f = h[5];
		int g = h[6];
		int hh = h[7];
		for (int n = 0; n < 64; n++) {
			int t1 = hh
					+ (Integer.rotateRight(e, 6) ^ Integer.rotateRight(e, 11) ^ Integer.rotateRight(e, 25))
					+ ((e & f) ^ (~e & g))
					+ K[n] + w[n];
			int t2 = (Integer.rotateRight(a, 2) ^ Integer.rotateRight(a, 13) ^ Integer.rotateRight(a, 22))
					+ ((a & b) ^ (a & c) ^ (b & c));
			hh = g;
			g = f;
			f = e;
			e = d + t1;
			d = c;
			c = b;
			b = a;
			a = t1 + t2;
		}
		h[0] += a;
		h[1] += b;
		h[2] += c;
		h[3] += d;
		h[4] += e;
		h[5] += f;
		h[6] += g;
		h[7] += hh;
	}

	private static void putLong(long x, byte[] buf, int off) {
		for (int i = 7; i >= 0; i--) {
			buf[off + i] = (byte) x;
			x >>>= 8;
		}
	}

	@Override
	public String toString() {
		return "RawSHA256 { ... }";
	}
}
