/* This code is part of LSX. It is distributed under the GNU General
 * Public License, version 2 (or at your option any later version). See
 * http://www.gnu.org/ for further details of the GPL. */
package lsx.crypt;

/**
 * Thrown when a SHA-256 accumulator would absorb 2^61 bytes or more, at which
 * point the message bit length no longer fits the 64-bit length field.
 * The accumulator is left exactly as it was before the rejected call, so a
 * caller that catches this may still finish the message hashed so far.
 */
public class HashLimitExceededException extends RuntimeException {
    private static final long serialVersionUID = -1;

    private final long byteCount;
    private final long requested;

    public HashLimitExceededException(long byteCount, long requested) {
        super("Cannot hash more than 2^61 bytes: already hashed " + byteCount
                + ", asked for " + requested + " more");
        this.byteCount = byteCount;
        this.requested = requested;
    }

    /** Bytes already absorbed when the limit was hit. */
    public long getByteCount() {
        return byteCount;
    }

    /** Bytes the rejected call tried to add. */
    public long getRequested() {
        return requested;
    }
}
