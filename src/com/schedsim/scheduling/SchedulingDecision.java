package com.schedsim.scheduling;

/**
 * SchedulingDecision
 *
 * Resultado de una consulta a la política: el id del proceso que debe ocupar
 * la CPU y cuántos ticks se le conceden, o bien IDLE si no hay nada listo.
 */
public final class SchedulingDecision {
    private static final SchedulingDecision IDLE = new SchedulingDecision(-1, 0);

    private final int selectedId;
    private final int allottedTicks;

    private SchedulingDecision(int selectedId, int allottedTicks) {
        this.selectedId = selectedId;
        this.allottedTicks = allottedTicks;
    }

    /**
     * Decisión de ejecutar un proceso.
     *
     * @param selectedId    id del proceso elegido
     * @param allottedTicks ticks concedidos (mayor que 0)
     * @return decisión
     */
    public static SchedulingDecision run(int selectedId, int allottedTicks) {
        if (allottedTicks <= 0) {
            throw new IllegalArgumentException("allotted ticks must be > 0");
        }
        return new SchedulingDecision(selectedId, allottedTicks);
    }

    /**
     * Decisión de dejar la CPU ociosa.
     *
     * @return decisión IDLE
     */
    public static SchedulingDecision idle() {
        return IDLE;
    }

    public boolean isIdle() {
        return this == IDLE;
    }

    public int getSelectedId() {
        return selectedId;
    }

    public int getAllottedTicks() {
        return allottedTicks;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof SchedulingDecision)) {
            return false;
        }
        SchedulingDecision other = (SchedulingDecision) o;
        return selectedId == other.selectedId && allottedTicks == other.allottedTicks;
    }

    @Override
    public int hashCode() {
        return 31 * selectedId + allottedTicks;
    }

    @Override
    public String toString() {
        return isIdle() ? "Idle" : "Run(P" + selectedId + ", " + allottedTicks + ")";
    }
}
