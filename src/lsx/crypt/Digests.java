/* This code is part of LSX. It is distributed under the GNU General
 * Public License, version 2 (or at your option any later version). See
 * http://www.gnu.org/ for further details of the GPL. */
package lsx.crypt;

import org.bouncycastle.crypto.ExtendedDigest;
import org.bouncycastle.crypto.OutputLengthException;

/**
 * Adapts this library's digests to BouncyCastle's {@link ExtendedDigest}, so
 * that HMac and the like can use them.
 */
public final class Digests {

    private Digests() {
    }

    /** @return A SHA-256 digest backed by {@link BufferedSHA256}. */
    public static ExtendedDigest sha256() {
        return new SHA256Digest();
    }

    /**
     * BouncyCastle digests reset themselves in doFinal(); ours are consumed,
     * so each doFinal() or reset() swaps in a fresh accumulator.
     */
    static final class SHA256Digest implements ExtendedDigest {
        private BufferedSHA256 state = new BufferedSHA256();

        @Override
        public String getAlgorithmName() {
            return "SHA-256";
        }

        @Override
        public int getDigestSize() {
            return RawSHA256.HASH_SIZE;
        }

        @Override
        public int getByteLength() {
            return RawSHA256.BLOCK_SIZE;
        }

        @Override
        public void update(byte in) {
            state.update(in);
        }

        @Override
        public void update(byte[] in, int inOff, int len) {
            state.update(in, inOff, len);
        }

        @Override
        public int doFinal(byte[] out, int outOff) {
            if (outOff < 0 || outOff > out.length - RawSHA256.HASH_SIZE)
                throw new OutputLengthException("output buffer too short");
            byte[] digest = state.finish();
            state = new BufferedSHA256();
            System.arraycopy(digest, 0, out, outOff, digest.length);
            return digest.length;
        }

        @Override
        public void reset() {
            state = new BufferedSHA256();
        }
    }
}
