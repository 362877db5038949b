package com.lastchair.service;

import com.lastchair.model.RevealedChoice;
import org.bouncycastle.jcajce.provider.digest.Keccak;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Base64;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Commitment hash and reveal credential codec shared with the game client.
 * <p>
 * Commitment: {@code keccak256(word(chair) || word(trap1) || word(trap2) || word(trap3) || salt)} where
 * {@code word} is a 32-byte big-endian integer and the salt is 32 random bytes.
 * <p>
 * Credential: {@code proof || word(chair) || word(trap1) || word(trap2) || word(trap3)}, base64 encoded.
 * The proof section is opaque here and only interpreted by a {@link ProofVerifier}.
 */
public final class CommitmentCodec {

    private static final Pattern HEX_64 = Pattern.compile("^[0-9a-f]{64}$");
    private static final BigInteger MAX_SCALAR = BigInteger.valueOf(Integer.MAX_VALUE);

    public static final int WORD_BYTES = 32;
    public static final int SALT_BYTES = 32;
    public static final int TRAILING_SCALARS = 4;
    public static final int TRAILING_BYTES = TRAILING_SCALARS * WORD_BYTES;

    private CommitmentCodec() {
    }

    public static RevealCredential decodeCredentialBase64(String encodedCredential) {
        if (encodedCredential == null || encodedCredential.isBlank()) {
            throw new IllegalArgumentException("Reveal credential is required");
        }
        byte[] credential;
        try {
            credential = Base64.getDecoder().decode(encodedCredential.trim());
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Reveal credential is not valid base64", e);
        }
        return decodeCredential(credential);
    }

    public static RevealCredential decodeCredential(byte[] credential) {
        if (credential.length < TRAILING_BYTES) {
            throw new IllegalArgumentException(
                    "Reveal credential too short: expected at least " + TRAILING_BYTES + " bytes, got " + credential.length);
        }

        int proofLength = credential.length - TRAILING_BYTES;
        byte[] proof = Arrays.copyOfRange(credential, 0, proofLength);

        List<Integer> scalars = new ArrayList<>(TRAILING_SCALARS);
        for (int i = 0; i < TRAILING_SCALARS; i++) {
            int offset = proofLength + i * WORD_BYTES;
            BigInteger value = new BigInteger(1, Arrays.copyOfRange(credential, offset, offset + WORD_BYTES));
            if (value.compareTo(MAX_SCALAR) > 0) {
                throw new IllegalArgumentException("Reveal credential scalar " + i + " is out of range");
            }
            scalars.add(value.intValueExact());
        }

        RevealedChoice claimed = new RevealedChoice(scalars.get(0), scalars.get(1), scalars.get(2), scalars.get(3));
        return new RevealCredential(proof, claimed);
    }

    public static byte[] encodeCredential(byte[] proof, RevealedChoice choice) {
        byte[] out = new byte[proof.length + TRAILING_BYTES];
        System.arraycopy(proof, 0, out, 0, proof.length);
        int offset = proof.length;
        for (int value : List.of(choice.chair(), choice.trap1(), choice.trap2(), choice.trap3())) {
            System.arraycopy(toWord(value), 0, out, offset, WORD_BYTES);
            offset += WORD_BYTES;
        }
        return out;
    }

    public static String encodeCredentialBase64(byte[] proof, RevealedChoice choice) {
        return Base64.getEncoder().encodeToString(encodeCredential(proof, choice));
    }

    public static String computeCommitment(RevealedChoice choice, byte[] salt) {
        if (salt.length != SALT_BYTES) {
            throw new IllegalArgumentException("Salt must be " + SALT_BYTES + " bytes");
        }
        if (choice.chair() < 0 || choice.trap1() < 0 || choice.trap2() < 0 || choice.trap3() < 0) {
            throw new IllegalArgumentException("Chair and traps must be non-negative");
        }

        byte[] preimage = new byte[TRAILING_BYTES + SALT_BYTES];
        int offset = 0;
        for (int value : List.of(choice.chair(), choice.trap1(), choice.trap2(), choice.trap3())) {
            System.arraycopy(toWord(value), 0, preimage, offset, WORD_BYTES);
            offset += WORD_BYTES;
        }
        System.arraycopy(salt, 0, preimage, offset, SALT_BYTES);

        Keccak.Digest256 digest = new Keccak.Digest256();
        return "0x" + toHex(digest.digest(preimage));
    }

    public static String normalizeCommitment(String commitment) {
        if (commitment == null) {
            throw new IllegalArgumentException("Commitment is required");
        }

        String trimmed = commitment.trim().toLowerCase();
        String withoutPrefix = trimmed.startsWith("0x") ? trimmed.substring(2) : trimmed;
        if (!HEX_64.matcher(withoutPrefix).matches()) {
            throw new IllegalArgumentException("Commitment must be 64 hex characters");
        }
        return "0x" + withoutPrefix;
    }

    private static byte[] toWord(int value) {
        byte[] word = new byte[WORD_BYTES];
        word[WORD_BYTES - 4] = (byte) (value >>> 24);
        word[WORD_BYTES - 3] = (byte) (value >>> 16);
        word[WORD_BYTES - 2] = (byte) (value >>> 8);
        word[WORD_BYTES - 1] = (byte) value;
        return word;
    }

    private static String toHex(byte[] bytes) {
        StringBuilder out = new StringBuilder(bytes.length * 2);
        for (byte value : bytes) {
            out.append(Character.forDigit((value >>> 4) & 0x0f, 16));
            out.append(Character.forDigit(value & 0x0f, 16));
        }
        return out.toString();
    }

    /**
     * @param proof   opaque proof section preceding the trailing scalars
     * @param claimed the four trailing scalars as the caller's claimed reveal
     */
    public record RevealCredential(byte[] proof, RevealedChoice claimed) {
    }
}
