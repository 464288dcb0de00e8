package org.absint.dataflow.interval;

/**
 * Instructions of a small counter language: assigning a constant, adding a constant, and
 * assuming a comparison against a constant (the branches of a loop condition).
 */
public abstract class IntervalInstruction {

    /** The variable the instruction reads and writes. */
    protected final String variable;

    /** The constant operand. */
    protected final long constant;

    private IntervalInstruction(String variable, long constant) {
        this.variable = variable;
        this.constant = constant;
    }

    /**
     * @param variable the assigned variable
     * @param value the assigned value
     * @return the instruction {@code variable = value}
     */
    public static IntervalInstruction assign(String variable, long value) {
        return new Assign(variable, value);
    }

    /**
     * @param variable the incremented variable
     * @param delta the value added
     * @return the instruction {@code variable += delta}
     */
    public static IntervalInstruction increment(String variable, long delta) {
        return new Increment(variable, delta);
    }

    /**
     * @param variable the tested variable
     * @param bound the exclusive upper bound
     * @return the instruction {@code assume(variable < bound)}
     */
    public static IntervalInstruction assumeLessThan(String variable, long bound) {
        return new AssumeLessThan(variable, bound);
    }

    /**
     * @param variable the tested variable
     * @param bound the inclusive lower bound
     * @return the instruction {@code assume(variable >= bound)}
     */
    public static IntervalInstruction assumeAtLeast(String variable, long bound) {
        return new AssumeAtLeast(variable, bound);
    }

    /** @return the variable the instruction reads and writes */
    public String getVariable() {
        return variable;
    }

    /**
     * Execute the instruction.
     *
     * @param pre the store before the instruction
     * @return the store after the instruction
     */
    public abstract IntervalStore execute(IntervalStore pre);

    /** {@code variable = constant}. */
    static final class Assign extends IntervalInstruction {
        Assign(String variable, long value) {
            super(variable, value);
        }

        @Override
        public IntervalStore execute(IntervalStore pre) {
            return pre.set(variable, Interval.constant(constant));
        }

        @Override
        public String toString() {
            return variable + " = " + constant;
        }
    }

    /** {@code variable += constant}. */
    static final class Increment extends IntervalInstruction {
        Increment(String variable, long delta) {
            super(variable, delta);
        }

        @Override
        public IntervalStore execute(IntervalStore pre) {
            return pre.set(variable, pre.get(variable).add(constant));
        }

        @Override
        public String toString() {
            return variable + " += " + constant;
        }
    }

    /** {@code assume(variable < constant)}. */
    static final class AssumeLessThan extends IntervalInstruction {
        AssumeLessThan(String variable, long bound) {
            super(variable, bound);
        }

        @Override
        public IntervalStore execute(IntervalStore pre) {
            if (constant == Interval.MINUS_INFINITY) {
                return IntervalStore.bottom();
            }
            return pre.set(
                    variable,
                    pre.get(variable).meet(Interval.of(Interval.MINUS_INFINITY, constant - 1)));
        }

        @Override
        public String toString() {
            return "assume " + variable + " < " + constant;
        }
    }

    /** {@code assume(variable >= constant)}. */
    static final class AssumeAtLeast extends IntervalInstruction {
        AssumeAtLeast(String variable, long bound) {
            super(variable, bound);
        }

        @Override
        public IntervalStore execute(IntervalStore pre) {
            return pre.set(
                    variable,
                    pre.get(variable).meet(Interval.of(constant, Interval.PLUS_INFINITY)));
        }

        @Override
        public String toString() {
            return "assume " + variable + " >= " + constant;
        }
    }
}
