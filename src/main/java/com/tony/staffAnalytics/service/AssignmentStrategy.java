package com.tony.staffAnalytics.service;

import com.tony.staffAnalytics.model.CandidateRecord;
import com.tony.staffAnalytics.model.PoolCandidate;
import com.tony.staffAnalytics.model.RoleSide;

import java.util.List;
import java.util.Map;
import java.util.function.BiPredicate;

/**
 * Répartit les candidats du voisinage sur les postes ouverts.
 */
public interface AssignmentStrategy {

    /**
     * @param positions            postes à pourvoir, dans l'ordre du catalogue
     * @param pool                 candidats scorés
     * @param eligible             vrai si le candidat peut occuper le poste
     * @param candidatesPerPosition taille de la liste conservée par poste
     * @return candidats retenus par clé de poste ; un poste sans candidat est absent
     */
    Map<String, List<CandidateRecord>> assign(List<RoleSide> positions,
                                              List<PoolCandidate> pool,
                                              BiPredicate<PoolCandidate, RoleSide> eligible,
                                              int candidatesPerPosition);
}
