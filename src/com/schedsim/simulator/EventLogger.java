package com.schedsim.simulator;

import java.util.ArrayList;
import java.util.List;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * EventLogger
 *
 * Registro de eventos de una simulación. Cada entrada lleva el tick simulado
 * (no la hora real), de modo que dos ejecuciones con la misma entrada
 * producen exactamente la misma traza. Las entradas se reenvían a Log4j en
 * nivel DEBUG y a los listeners registrados.
 *
 * Pertenece a una única instancia de {@link SchedulerEngine}; no es
 * thread-safe.
 */
public class EventLogger {
    private static final Logger logger = LogManager.getLogger(EventLogger.class);

    private final List<String> events;
    private final List<EventListener> listeners;

    /**
     * Interfaz usada por listeners que desean recibir notificaciones de nuevos
     * eventos.
     */
    public interface EventListener {
        /**
         * Invocado cuando se registra un nuevo evento.
         *
         * @param event entrada de log ya formateada con el tick
         */
        void eventLogged(String event);
    }

    /**
     * Construye un EventLogger vacío.
     */
    public EventLogger() {
        this.events = new ArrayList<>();
        this.listeners = new ArrayList<>();
    }

    /**
     * Registra un mensaje asociado a un tick y notifica listeners.
     *
     * @param tick    tick simulado
     * @param message mensaje a registrar
     */
    public void log(int tick, String message) {
        String logEntry = "[T=" + tick + "] " + message;
        events.add(logEntry);
        logger.debug(logEntry);
        for (EventListener listener : listeners) {
            listener.eventLogged(logEntry);
        }
    }

    /**
     * Registra un listener que será notificado en cada nuevo evento.
     *
     * @param listener listener a añadir
     */
    public void addListener(EventListener listener) {
        listeners.add(listener);
    }

    /**
     * Descarta las entradas registradas; los listeners se conservan.
     */
    public void clear() {
        events.clear();
    }

    /**
     * Devuelve una copia de las entradas registradas.
     *
     * @return lista de eventos
     */
    public List<String> getEvents() {
        return new ArrayList<>(events);
    }
}
