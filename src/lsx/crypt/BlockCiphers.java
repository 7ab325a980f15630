/* This code is part of LSX. It is distributed under the GNU General
 * Public License, version 2 (or at your option any later version). See
 * http://www.gnu.org/ for further details of the GPL. */
package lsx.crypt;

import org.bouncycastle.crypto.BlockCipher;
import org.bouncycastle.crypto.CipherParameters;
import org.bouncycastle.crypto.DataLengthException;
import org.bouncycastle.crypto.OutputLengthException;
import org.bouncycastle.crypto.params.KeyParameter;

import lsx.crypt.ciphers.Twofish;

/**
 * Adapts this library's ciphers to BouncyCastle's lightweight
 * {@link BlockCipher}, so that its modes and MACs can run over them.
 */
public final class BlockCiphers {

    private BlockCiphers() {
    }

    /** @return An uninitialised Twofish engine; call init() with a KeyParameter. */
    public static BlockCipher twofish() {
        return new TwofishBlockCipher();
    }

    static final class TwofishBlockCipher implements BlockCipher {
        private Twofish cipher;
        private boolean forEncryption;

        @Override
        public void init(boolean forEncryption, CipherParameters params) throws IllegalArgumentException {
            if (!(params instanceof KeyParameter))
                throw new IllegalArgumentException("Twofish needs a KeyParameter, got "
                        + (params == null ? "null" : params.getClass().getName()));
            this.cipher = Twofish.forKey(((KeyParameter) params).getKey());
            this.forEncryption = forEncryption;
        }

        @Override
        public String getAlgorithmName() {
            return "Twofish";
        }

        @Override
        public int getBlockSize() {
            return Twofish.BLOCK_SIZE;
        }

        @Override
        public int processBlock(byte[] in, int inOff, byte[] out, int outOff) throws DataLengthException {
            if (cipher == null)
                throw new IllegalStateException("Twofish not initialised");
            if (inOff < 0 || inOff > in.length - Twofish.BLOCK_SIZE)
                throw new DataLengthException("input buffer too short");
            if (outOff < 0 || outOff > out.length - Twofish.BLOCK_SIZE)
                throw new OutputLengthException("output buffer too short");
            if (forEncryption)
                cipher.encipher(in, inOff, out, outOff);
            else
                cipher.decipher(in, inOff, out, outOff);
            return Twofish.BLOCK_SIZE;
        }

        @Override
        public void reset() {
            // ECB on one block carries nothing between calls
        }
    }
}
