package com.tony.staffAnalytics.exception;

/**
 * Le head coach ciblé n'existe pas dans le réseau : le run complet est invalide.
 */
public class CoachNotFoundException extends RuntimeException {

    public CoachNotFoundException(String coach) {
        super("Head coach '" + coach + "' not found in network!");
    }
}
