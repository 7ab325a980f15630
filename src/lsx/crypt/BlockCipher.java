/* This code is part of LSX. It is distributed under the GNU General
 * Public License, version 2 (or at your option any later version). See
 * http://www.gnu.org/ for further details of the GPL. */
package lsx.crypt;

/**
 * Defines the interface implemented by the symmetric block ciphers in this
 * library. A BlockCipher is keyed when it is constructed and never changes
 * afterwards, so one instance may be shared by any number of threads.
 * No mode of operation or padding is applied: every call transforms exactly
 * one block.
 */
public interface BlockCipher {

    /**
     * Returns the key size, in bits, of the given block-cipher
     */
    int getKeySize();

    /**
     * Returns the block size, in bits, of the given block-cipher
     */
    int getBlockSize();

    /**
     * Enciphers the contents of <b>block</b> where block must be equal
     * to getBlockSize()/8. The result is placed in result and, too has
     * to have length getBlockSize()/8.
     * Block and result may refer to the same array.
     */
    void encipher(byte[] block, byte[] result);

    /**
     * Enciphers one block read from <b>in</b> at <b>inOffset</b> into
     * <b>out</b> at <b>outOffset</b>. The two ranges may overlap.
     */
    void encipher(byte[] in, int inOffset, byte[] out, int outOffset);

    /**
     * Deciphers the contents of <b>block</b> where block must be equal
     * to getBlockSize()/8. The result is placed in result and, too has
     * to have length getBlockSize()/8.
     * Block and result may refer to the same array.
     */
    void decipher(byte[] block, byte[] result);

    /**
     * Deciphers one block read from <b>in</b> at <b>inOffset</b> into
     * <b>out</b> at <b>outOffset</b>. The two ranges may overlap.
     */
    void decipher(byte[] in, int inOffset, byte[] out, int outOffset);

}
