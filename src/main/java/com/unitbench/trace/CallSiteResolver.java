package com.unitbench.trace;

import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Finds, in a captured stack, the assertion call made directly from a test method.
 *
 * Walking from the innermost frame outward, the resolver stops at the first index
 * {@code i} where frame {@code i} runs one of the test methods on the subject's
 * class hierarchy and frame {@code i-1} was invoked on the subject itself. Helper
 * assertions layered between the primitive and the test method are skipped over
 * that way, so {@code assertEqual -> check} is attributed to {@code assertEqual}.
 *
 * A frame with a receiver is matched by identity; a frame without one is matched
 * by its declaring class being in the subject's {@link InheritanceChain}.
 *
 * Pure function over its inputs.
 */
public class CallSiteResolver {

    /**
     * @param stack       frames innermost first
     * @param testMethods names of the subject's test methods
     * @param self        the subject instance
     * @return the call site, or empty when no test-method boundary is on the stack
     */
    public Optional<CallSite> locate(List<StackFrame> stack, Set<String> testMethods, Object self) {
        InheritanceChain chain = InheritanceChain.of(self.getClass());

        for (int i = 1; i < stack.size(); i++) {
            StackFrame frame  = stack.get(i);
            StackFrame caller = stack.get(i - 1);

            if (testMethods.contains(frame.getFunction())
                    && chain.contains(frame.getClassName())
                    && isInvokedOn(caller, self, chain)) {
                return Optional.of(new CallSite(caller, frame));
            }
        }
        return Optional.empty();
    }

    private static boolean isInvokedOn(StackFrame frame, Object self, InheritanceChain chain) {
        if (frame.hasReceiver()) {
            return frame.getReceiver() == self;
        }
        return chain.contains(frame.getClassName());
    }
}
