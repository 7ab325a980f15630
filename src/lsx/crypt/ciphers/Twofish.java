/* This code is part of LSX. It is distributed under the GNU General
 * Public License, version 2 (or at your option any later version). See
 * http://www.gnu.org/ for further details of the GPL. */
package lsx.crypt.ciphers;

import java.security.InvalidKeyException;

import lsx.crypt.BlockCipher;
import lsx.crypt.UnsupportedCipherException;
import lsx.support.Logger;

/**
 * Interfaces with the Twofish AES candidate to implement the Twofish
 * algorithm. The key schedule runs once, in the constructor; afterwards the
 * instance never changes and may be shared between threads.
 */
public final class Twofish implements BlockCipher {

    /** Size (in bytes) of a Twofish block */
    public static final int BLOCK_SIZE = Twofish_Algorithm.BLOCK_SIZE;

    private final Twofish_Algorithm.SessionKey sessionKey;
    private final int keysize;

    /**
     * @param keysize The key size in bits: 128, 192 or 256.
     * @param key Exactly keysize/8 bytes of key material.
     * @throws UnsupportedCipherException if Twofish has no such key size.
     * @throws IllegalArgumentException if the key has the wrong length.
     */
    public Twofish(int keysize, byte[] key) throws UnsupportedCipherException {
        if (!((keysize == 128) ||
              (keysize == 192) ||
              (keysize == 256)))
            throw new UnsupportedCipherException("Invalid keysize: " + keysize);
        if (key == null)
            throw new NullPointerException();
        if (key.length != keysize >> 3)
            throw new IllegalArgumentException("A " + keysize + "-bit key must be "
                    + (keysize >> 3) + " bytes, got " + key.length);
        this.keysize = keysize;
        this.sessionKey = derive(key);
    }

    private Twofish(byte[] key) {
        this.keysize = key.length << 3;
        this.sessionKey = derive(key);
    }

    public static Twofish new128(byte[] key) {
        return withLength(key, 16);
    }

    public static Twofish new192(byte[] key) {
        return withLength(key, 24);
    }

    public static Twofish new256(byte[] key) {
        return withLength(key, 32);
    }

    /** Pick the variant from the length of <b>key</b>: 16, 24 or 32 bytes. */
    public static Twofish forKey(byte[] key) {
        int length = key.length;
        if (length != 16 && length != 24 && length != 32)
            throw new IllegalArgumentException("Twofish keys are 16, 24 or 32 bytes, got " + length);
        return new Twofish(key);
    }

    private static Twofish withLength(byte[] key, int length) {
        if (key.length != length)
            throw new IllegalArgumentException("Expected a " + length + "-byte key, got " + key.length);
        return new Twofish(key);
    }

    private static Twofish_Algorithm.SessionKey derive(byte[] key) {
        try {
            return Twofish_Algorithm.makeKey(key);
        } catch (InvalidKeyException e) {
            Logger.error(Twofish.class, "Invalid key", e);
            throw new IllegalArgumentException(e.getMessage(), e);
        }
    }

    @Override
    public int getBlockSize() {
        return BLOCK_SIZE << 3;
    }

    @Override
    public int getKeySize() {
        return keysize;
    }

    /** @return A new array holding the encryption of one 16-byte block. */
    public byte[] encrypt(byte[] plaintext) {
        byte[] result = new byte[BLOCK_SIZE];
        encipher(plaintext, result);
        return result;
    }

    /** @return A new array holding the decryption of one 16-byte block. */
    public byte[] decrypt(byte[] ciphertext) {
        byte[] result = new byte[BLOCK_SIZE];
        decipher(ciphertext, result);
        return result;
    }

    @Override
    public void encipher(byte[] block, byte[] result) {
        checkBlock(block);
        checkBlock(result);
        Twofish_Algorithm.blockEncrypt(block, 0, result, 0, sessionKey);
    }

    @Override
    public void encipher(byte[] in, int inOffset, byte[] out, int outOffset) {
        checkRange(in, inOffset);
        checkRange(out, outOffset);
        Twofish_Algorithm.blockEncrypt(in, inOffset, out, outOffset, sessionKey);
    }

    @Override
    public void decipher(byte[] block, byte[] result) {
        checkBlock(block);
        checkBlock(result);
        Twofish_Algorithm.blockDecrypt(block, 0, result, 0, sessionKey);
    }

    @Override
    public void decipher(byte[] in, int inOffset, byte[] out, int outOffset) {
        checkRange(in, inOffset);
        checkRange(out, outOffset);
        Twofish_Algorithm.blockDecrypt(in, inOffset, out, outOffset, sessionKey);
    }

    /** Copies of the key-dependent tables, for comparing two contexts. */
    int[][] sBoxes() {
        int[][] copy = new int[4][];
        for (int i = 0; i < 4; i++)
            copy[i] = sessionKey.sBox[i].clone();
        return copy;
    }

    int[] subKeys() {
        return sessionKey.subKeys.clone();
    }

    /** Encrypt and decrypt a block with each key size. */
    public static boolean selfTest() {
        return Twofish_Algorithm.selfTest();
    }

    private static void checkBlock(byte[] block) {
        if (block.length != BLOCK_SIZE)
            throw new IllegalArgumentException("Block must be " + BLOCK_SIZE + " bytes, got " + block.length);
    }

    private static void checkRange(byte[] buf, int offset) {
        if (offset < 0 || offset > buf.length - BLOCK_SIZE)
            throw new IllegalArgumentException("No room for a block at offset " + offset
                    + " of a " + buf.length + "-byte array");
    }

    @Override
    public String toString() {
        return "Twofish[" + keysize + "-bit key]";
    }
}
