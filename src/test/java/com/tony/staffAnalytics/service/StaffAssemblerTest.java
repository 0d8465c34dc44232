package com.tony.staffAnalytics.service;

import com.tony.staffAnalytics.config.StaffBuilderProperties;
import com.tony.staffAnalytics.exception.CoachNotFoundException;
import com.tony.staffAnalytics.model.CandidateRecord;
import com.tony.staffAnalytics.model.ClosenessTable;
import com.tony.staffAnalytics.model.CoStaffGraph;
import com.tony.staffAnalytics.model.NetworkSnapshot;
import com.tony.staffAnalytics.model.RelationshipEdge;
import com.tony.staffAnalytics.model.StaffRecommendation;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.LocalDateTime;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import static com.tony.staffAnalytics.service.StaffFixtures.*;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class StaffAssemblerTest {

    private StaffAssembler assembler;
    private NetworkSnapshot network;

    @BeforeEach
    void setUp() {
        StaffBuilderProperties props = new StaffBuilderProperties();
        assembler = new StaffAssembler(new ConnectionScorer(props), new GreedyAssignmentStrategy(), props);

        // 1 (cible) - 2 (3 ans) ; 1 - 3 ; 3 - 4 ; 4 - 5 (distance 3) ; 6 isolé
        CoStaffGraph graph = new CoStaffGraph(
                List.of(coach(1, "Alpha", HC, 0.9),
                        coach(2, "Bravo", QB, 0.8),
                        coach(3, "Charlie", QB, 0.5),
                        coach(4, "Delta", LB, null),
                        coach(5, "Echo", QB, 1.0),
                        coach(6, "Foxtrot", HC, 0.7)),
                List.of(new RelationshipEdge(1, 2, 3, 0.9, 0.8),
                        new RelationshipEdge(1, 3, 1, 0.9, 0.5),
                        new RelationshipEdge(3, 4, 1, 0.5, null),
                        new RelationshipEdge(4, 5, 2, null, 1.0)));
        ClosenessTable table = closenessTable();
        network = new NetworkSnapshot(graph, table, new RolePromotionMapper(table, 0.4), LocalDateTime.now());
    }

    @Test
    @DisplayName("Affectation gloutonne : le meilleur candidat d'un poste n'est plus disponible ensuite")
    void greedyAssignmentShouldRemoveAssignedCoach() {
        StaffRecommendation rec = assembler.assemble(network, "Alpha");

        assertThat(rec.getPositions()).containsOnlyKeys(
                "Offensive Coordinator_Offense", "Defensive Coordinator_Defense", "QB Coach_Offense");

        List<CandidateRecord> oc = rec.getPositions().get("Offensive Coordinator_Offense");
        assertThat(oc).extracting(CandidateRecord::getCoachId).containsExactly(2L, 3L);
        assertThat(oc.get(0).isAssigned()).isTrue();
        assertThat(oc.get(1).isAssigned()).isFalse();
        assertThat(oc.get(0).getConnectionScore()).isCloseTo(1.6, within(1e-9));

        // Bravo est pris : Charlie récupère le poste de QB Coach
        assertThat(rec.getPositions().get("QB Coach_Offense"))
                .extracting(CandidateRecord::getCoachId).containsExactly(3L);
    }

    @Test
    @DisplayName("Un coach indirect sans valeur est scoré 0.3 x 0.5")
    void indirectCoachWithoutValueShouldUseDefault() {
        StaffRecommendation rec = assembler.assemble(network, "Alpha");

        CandidateRecord delta = rec.getPositions().get("Defensive Coordinator_Defense").get(0);
        assertThat(delta.getCoachId()).isEqualTo(4L);
        assertThat(delta.getDegree()).isEqualTo(2);
        assertThat(delta.getYearsTogether()).isZero();
        assertThat(delta.getCoachValue()).isNull();
        assertThat(delta.getConnectionScore()).isCloseTo(0.15, within(1e-9));
    }

    @Test
    @DisplayName("Aucun coach ne peut être retenu deux fois, et la distance 3 est hors pool")
    void noCoachShouldBeAssignedTwice() {
        StaffRecommendation rec = assembler.assemble(network, "Alpha");

        Set<Long> seen = new HashSet<>();
        for (CandidateRecord c : rec.assignedCandidates()) {
            assertThat(seen.add(c.getCoachId())).isTrue();
        }
        assertThat(rec.allCandidates()).noneMatch(c -> c.getCoachId() == 5L);
        assertThat(rec.allCandidates()).noneMatch(c -> c.getCoachId() == 1L);
    }

    @Test
    @DisplayName("Degré 3 : le coach lointain entre dans le pool avec un score x0.1")
    void largerDegreeShouldReachFurtherCoaches() {
        StaffRecommendation rec = assembler.assemble(network, "Alpha", 3);

        assertThat(rec.allCandidates()).anyMatch(c -> c.getCoachId() == 5L && c.getDegree() == 3);
    }

    @Test
    @DisplayName("La cible peut être donnée par son coach_id")
    void targetShouldBeResolvedById() {
        StaffRecommendation rec = assembler.assemble(network, "1");

        assertThat(rec.getHeadCoachName()).isEqualTo("Alpha");
    }

    @Test
    @DisplayName("Head coach absent du réseau : erreur fatale")
    void unknownTargetShouldThrow() {
        assertThatThrownBy(() -> assembler.assemble(network, "Nobody"))
                .isInstanceOf(CoachNotFoundException.class)
                .hasMessage("Head coach 'Nobody' not found in network!");
    }

    @Test
    @DisplayName("Head coach isolé : recommandation vide, pas d'erreur")
    void isolatedTargetShouldGiveEmptyRecommendation() {
        StaffRecommendation rec = assembler.assemble(network, "Foxtrot");

        assertThat(rec.isEmpty()).isTrue();
        assertThat(rec.allCandidates()).isEmpty();
    }

    @Test
    @DisplayName("Même résultat à chaque exécution")
    void assemblyShouldBeDeterministic() {
        StaffRecommendation first = assembler.assemble(network, "Alpha");
        StaffRecommendation second = assembler.assemble(network, "Alpha");

        assertThat(second.allCandidates()).isEqualTo(first.allCandidates());
    }
}
