/** Twofish. The algorithm class holds the Cryptix-derived key schedule and
 * round function; {@link lsx.crypt.ciphers.Twofish} is the keyed, immutable
 * context callers use. */
package lsx.crypt.ciphers;
