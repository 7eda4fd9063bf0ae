package org.dballot.proposal;

import org.dballot.governance.BallotError;
import org.dballot.governance.BallotException;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;

/**
 * Fixed-size proposal label: the UTF-8 bytes of a name, zero padded to {@value #SIZE} bytes.
 */
public final class ProposalLabel {

    public static final int SIZE = 32;

    private final byte[] bytes;

    private ProposalLabel(byte[] bytes) {
        this.bytes = bytes;
    }

    /**
     * Encodes a proposal name.
     *
     * @param name   the display name, non-null
     * @param policy how to treat names longer than {@link #SIZE} bytes
     * @return the label
     * @throws BallotException {@link BallotError#INVALID_INPUT} for a null name, a name holding NUL
     *                         characters, or an oversized name under {@link LabelPolicy#REJECT}
     */
    public static ProposalLabel encode(String name, LabelPolicy policy) {
        if (name == null)
            throw new BallotException(BallotError.INVALID_INPUT, "Proposal name must not be null");
        if (name.indexOf('\0') >= 0)
            throw new BallotException(BallotError.INVALID_INPUT, "Proposal name must not contain NUL characters");

        byte[] utf8 = name.getBytes(StandardCharsets.UTF_8);
        if (utf8.length > SIZE) {
            if (policy == LabelPolicy.REJECT)
                throw new BallotException(BallotError.INVALID_INPUT,
                        "Proposal name exceeds " + SIZE + " bytes: " + name);
            utf8 = truncate(name);
        }
        return new ProposalLabel(Arrays.copyOf(utf8, SIZE));
    }

    public static ProposalLabel fromBytes(byte[] raw) {
        if (raw == null || raw.length != SIZE)
            throw new IllegalArgumentException("Label must be exactly " + SIZE + " bytes");
        return new ProposalLabel(raw.clone());
    }

    private static byte[] truncate(String name) {
        StringBuilder kept = new StringBuilder();
        int used = 0;
        int i = 0;
        while (i < name.length()) {
            int codePoint = name.codePointAt(i);
            int width = new String(Character.toChars(codePoint)).getBytes(StandardCharsets.UTF_8).length;
            if (used + width > SIZE)
                break;
            kept.appendCodePoint(codePoint);
            used += width;
            i += Character.charCount(codePoint);
        }
        return kept.toString().getBytes(StandardCharsets.UTF_8);
    }

    public byte[] toBytes() {
        return bytes.clone();
    }

    /**
     * @return the name with the zero padding stripped
     */
    public String name() {
        int end = bytes.length;
        while (end > 0 && bytes[end - 1] == 0)
            end--;
        return new String(bytes, 0, end, StandardCharsets.UTF_8);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return Arrays.equals(bytes, ((ProposalLabel) o).bytes);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(bytes);
    }

    @Override
    public String toString() {
        return name();
    }
}
