package com.vtb.refiner.semantic;

import com.vtb.refiner.models.Cluster;
import com.vtb.refiner.models.Threat;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.Deque;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Семантическая дедупликация активных угроз.
 *
 * Кластеризация DBSCAN по косинусному сходству (eps = порог сходства, minPts = 1, то есть каждая
 * угроза сама является ядром). Угрозы разных категорий STRIDE никогда не попадают в один кластер.
 * Представитель кластера: максимальный inherent score, затем более короткий id, затем id по алфавиту.
 * Представитель забирает объединение CVE, прочих ссылок и мер защиты участников, остальные
 * получают статус MERGED.
 *
 * Работает как барьер: видит весь пакет целиком, поэтому вызывается в одном потоке.
 */
@Slf4j
public class SemanticDeduplicator {

    static final Comparator<Threat> REPRESENTATIVE_ORDER = Comparator
        .comparingDouble(Threat::getInherentRiskScore).reversed()
        .thenComparingInt((Threat t) -> t.getId().length())
        .thenComparing(Threat::getId);

    private final ThreatEmbedder embedder;
    private final double similarityThreshold;
    private final boolean requireSameComponent;

    public SemanticDeduplicator(ThreatEmbedder embedder, double similarityThreshold, boolean requireSameComponent) {
        this.embedder = Objects.requireNonNull(embedder, "embedder");
        this.similarityThreshold = similarityThreshold;
        this.requireSameComponent = requireSameComponent;
    }

    public SemanticDeduplicator(double similarityThreshold) {
        this(new TermVectorEmbedder(), similarityThreshold, false);
    }

    /**
     * Сгруппировать угрозы и слить дубликаты.
     *
     * @param threats активные угрозы в порядке пакета
     * @return кластеры (включая одиночные) в порядке первого участника
     */
    public List<Cluster> deduplicate(List<Threat> threats) {
        for (Threat threat : threats) {
            if (!threat.isActive()) {
                throw new IllegalStateException("В дедупликацию передана неактивная угроза " + threat.getId());
            }
        }

        int n = threats.size();
        List<SparseVector> vectors = new ArrayList<>(n);
        for (Threat threat : threats) {
            vectors.add(embedder.embed(threat));
        }

        int[] assignment = new int[n];
        Arrays.fill(assignment, -1);
        List<List<Integer>> groups = new ArrayList<>();

        for (int start = 0; start < n; start++) {
            if (assignment[start] >= 0) {
                continue;
            }
            int groupIndex = groups.size();
            List<Integer> members = new ArrayList<>();
            Deque<Integer> queue = new ArrayDeque<>();
            assignment[start] = groupIndex;
            queue.add(start);
            while (!queue.isEmpty()) {
                int current = queue.poll();
                members.add(current);
                for (int candidate = 0; candidate < n; candidate++) {
                    if (assignment[candidate] < 0 && isNeighbor(threats.get(current), vectors.get(current),
                        threats.get(candidate), vectors.get(candidate))) {
                        assignment[candidate] = groupIndex;
                        queue.add(candidate);
                    }
                }
            }
            members.sort(Integer::compareTo);
            groups.add(members);
        }

        List<Cluster> clusters = new ArrayList<>(groups.size());
        int merged = 0;
        for (int i = 0; i < groups.size(); i++) {
            List<Threat> members = new ArrayList<>();
            for (int index : groups.get(i)) {
                members.add(threats.get(index));
            }
            String clusterId = String.format("CL-%04d", i + 1);
            Threat representative = members.stream().min(REPRESENTATIVE_ORDER).orElseThrow();
            absorb(representative, members);

            for (Threat member : members) {
                member.setClusterId(clusterId);
                if (member != representative) {
                    member.mergeInto(representative.getId());
                    merged++;
                }
            }
            List<String> memberIds = new ArrayList<>();
            members.forEach(member -> memberIds.add(member.getId()));
            clusters.add(Cluster.builder()
                .clusterId(clusterId)
                .strideCategory(representative.getStrideCategory())
                .memberThreatIds(memberIds)
                .representativeId(representative.getId())
                .build());
            if (members.size() > 1) {
                log.debug("Кластер {} ({}): представитель {}, участники {}", clusterId,
                    representative.getStrideCategory(), representative.getId(), memberIds);
            }
        }

        log.info("Дедупликация: {} угроз -> {} кластеров, слито {}", n, clusters.size(), merged);
        return clusters;
    }

    private boolean isNeighbor(Threat left, SparseVector leftVector, Threat right, SparseVector rightVector) {
        if (left.getStrideCategory() != right.getStrideCategory()) {
            return false;
        }
        if (requireSameComponent && !sameComponent(left, right)) {
            return false;
        }
        return leftVector.cosine(rightVector) >= similarityThreshold;
    }

    private static boolean sameComponent(Threat left, Threat right) {
        return TextSimilarity.normalize(left.getEffectiveComponent())
            .equals(TextSimilarity.normalize(right.getEffectiveComponent()));
    }

    /**
     * Представитель получает все ссылки и меры защиты группы, чтобы ничего не потерялось при слиянии
     */
    private static void absorb(Threat representative, List<Threat> members) {
        Set<String> cves = new LinkedHashSet<>(representative.getCitedCves());
        Set<String> references = new LinkedHashSet<>(representative.getOtherReferences());
        Set<String> irrelevant = new LinkedHashSet<>(representative.getIrrelevantCves());
        Set<String> mitigations = new LinkedHashSet<>(representative.getMitigationSuggestions());
        for (Threat member : members) {
            if (member == representative) {
                continue;
            }
            cves.addAll(member.getCitedCves());
            references.addAll(member.getOtherReferences());
            irrelevant.addAll(member.getIrrelevantCves());
            mitigations.addAll(member.getMitigationSuggestions());
        }
        representative.setCitedCves(cves);
        representative.setOtherReferences(references);
        representative.setIrrelevantCves(irrelevant);
        representative.setMitigationSuggestions(new ArrayList<>(mitigations));
    }
}
