/* This code is part of LSX. It is distributed under the GNU General
 * Public License, version 2 (or at your option any later version). See
 * http://www.gnu.org/ for further details of the GPL. */
package lsx.crypt;

import java.util.Arrays;

/**
 * A SHA-256 accumulator that takes input of any length. Whole blocks go
 * straight to a {@link RawSHA256}; the tail of each update (less than one
 * block) waits in a small buffer for the next call.
 * <p>
 * Like the raw engine this is consumed by {@link #finish(byte[])} and is
 * not thread-safe.
 */
public final class BufferedSHA256 {

	private static final int BLOCK_SIZE = RawSHA256.BLOCK_SIZE;

	private final RawSHA256 inner;
	private final byte[] buf;
	/** Always less than BLOCK_SIZE between calls. */
	private int bufferedBytes;
	private boolean finished;

	/** Start a new hash. */
	public BufferedSHA256() {
		this(new RawSHA256(), new byte[BLOCK_SIZE], 0);
	}

	BufferedSHA256(RawSHA256 inner) {
		this(inner, new byte[BLOCK_SIZE], 0);
	}

	private BufferedSHA256(RawSHA256 inner, byte[] buf, int bufferedBytes) {
		this.inner = inner;
		this.buf = buf;
		this.bufferedBytes = bufferedBytes;
	}

	/** Add one byte to the hash. */
	public void update(byte b) {
		checkNotFinished();
		inner.checkCapacity(bufferedBytes + 1L);
		buf[bufferedBytes] = b;
		if (bufferedBytes + 1 == BLOCK_SIZE) {
			inner.update(buf, 0, BLOCK_SIZE);
			bufferedBytes = 0;
		} else {
			bufferedBytes++;
		}
	}

	/** Add the entire contents of the byte array to the hash. */
	public void update(byte[] data) {
		update(data, 0, data.length);
	}

	/**
	 * Add <b>length</b> bytes from <b>data</b> starting at <b>offset</b>.
	 * Any length is accepted.
	 * @throws HashLimitExceededException if the total would reach
	 * {@link RawSHA256#MAX_BYTES}; nothing is absorbed in that case.
	 */
	public void update(byte[] data, int offset, int length) {
		checkNotFinished();
		RawSHA256.checkRange(data, offset, length);
		inner.checkCapacity(bufferedBytes + (long) length);

		if (bufferedBytes > 0) {
			int remaining = BLOCK_SIZE - bufferedBytes;
			if (length < remaining) {
				System.arraycopy(data, offset, buf, bufferedBytes, length);
				bufferedBytes += length;
				return;
			}
			System.arraycopy(data, offset, buf, bufferedBytes, remaining);
			inner.update(buf, 0, BLOCK_SIZE);
			bufferedBytes = 0;
			offset += remaining;
			length -= remaining;
		}

		if (length >= BLOCK_SIZE) {
			int chop = length - (length % BLOCK_SIZE);
			inner.update(data, offset, chop);
			offset += chop;
			length -= chop;
		}

		System.arraycopy(data, offset, buf, 0, length);
		bufferedBytes = length;
	}

	/** Produce the digest of everything added so far. Consumes this accumulator. */
	public byte[] finish() {
		checkNotFinished();
		return finishBuffer();
	}

	/** Add any remaining data and produce the digest. Consumes this accumulator. */
	public byte[] finish(byte[] data) {
		return finish(data, 0, data.length);
	}

	public byte[] finish(byte[] data, int offset, int length) {
		checkNotFinished();
		RawSHA256.checkRange(data, offset, length);
		if (length != 0) update(data, offset, length);
		return finishBuffer();
	}

	private byte[] finishBuffer() {
		byte[] digest = inner.finish(buf, 0, bufferedBytes);
		finished = true;
		bufferedBytes = 0;
		Arrays.fill(buf, (byte) 0);
		return digest;
	}

	/** @return A new accumulator with the same state; both may continue independently. */
	public BufferedSHA256 copy() {
		checkNotFinished();
		return new BufferedSHA256(inner.copy(), buf.clone(), bufferedBytes);
	}

	/** @return The number of bytes added so far, including those still buffered. */
	public long getByteCount() {
		return inner.getByteCount() + bufferedBytes;
	}

	/** @return The number of bytes waiting for a full block. */
	public int getBufferedBytes() {
		return bufferedBytes;
	}

	public boolean isFinished() {
		return finished;
	}

	private void checkNotFinished() {
		if (finished)
			throw new IllegalStateException("SHA-256 state already finished");
	}

	@Override
	public String toString() {
		return "BufferedSHA256 { ... }";
	}
}
