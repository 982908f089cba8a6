package org.llasm.compiler.frontend.semantics;

import org.llasm.compiler.api.LoweringErrorCode;
import org.llasm.compiler.api.LoweringException;
import org.llasm.compiler.api.SourceInfo;

import java.util.Optional;

/**
 * Numbers the unnamed locals of a function.
 * <p>
 * Unnamed parameters, basic blocks and instruction results are named {@code 0}, {@code 1}, ...
 * in order of appearance. A local that is explicitly given a numeric name takes part in the
 * same sequence and must carry the next expected id.
 */
public final class LocalIdAssigner {

    private long next;

    /**
     * @param explicit The explicit name, or empty for an unnamed local.
     * @param construct The construct being named, e.g. "basic block".
     * @param at The position of the local.
     * @return The name of the local.
     * @throws LoweringException with {@link LoweringErrorCode#INVALID_LOCAL_ID} if an explicit
     *         numeric name is out of sequence.
     */
    public String assign(Optional<String> explicit, String construct, SourceInfo at) throws LoweringException {
        if (explicit.isEmpty()) {
            return Long.toString(next++);
        }
        String name = explicit.get();
        if (isLocalId(name)) {
            String expected = Long.toString(next);
            if (!expected.equals(name)) {
                throw new LoweringException(LoweringErrorCode.INVALID_LOCAL_ID, name, construct,
                        String.format("invalid local ID in %s; expected %%%s, got %%%s", construct, expected, name), at);
            }
            next++;
        }
        return name;
    }

    /**
     * @return The id the next unnamed local will receive.
     */
    public long peek() {
        return next;
    }

    static boolean isLocalId(String name) {
        return !name.isEmpty() && name.chars().allMatch(c -> c >= '0' && c <= '9');
    }
}
