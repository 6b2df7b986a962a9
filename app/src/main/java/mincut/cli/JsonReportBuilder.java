package mincut.cli;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import mincut.algorithm.MinCutRun;
import mincut.core.model.CutPartition;
import mincut.core.model.Graph;

/** JSON report of one graph's runs. Partition vertex ids are 1-based like the input files. */
final class JsonReportBuilder {
  private static final String VERSION = "1.0.0";
  private final Gson gson = new GsonBuilder().setPrettyPrinting().serializeNulls().create();

  String build(String label, Graph graph, List<MinCutRun> runs, boolean includePartitions) {
    Map<String, Object> root = new LinkedHashMap<>();
    root.put("meta", meta(label, graph, runs));
    root.put("runs", runSummaries(runs, includePartitions));
    runs.stream()
        .min((a, b) -> a.bestCut().compareTo(b.bestCut()))
        .ifPresent(best -> root.put("best_cut_size", best.cutSize()));
    return gson.toJson(root);
  }

  private Map<String, Object> meta(String label, Graph graph, List<MinCutRun> runs) {
    Map<String, Object> meta = new LinkedHashMap<>();
    meta.put("version", VERSION);
    meta.put("input", label);
    meta.put("vertex_count", graph.vertexCount());
    meta.put("edge_count", graph.edgeCount());
    meta.put("component_count", runs.isEmpty() ? null : runs.get(0).componentCount());
    return meta;
  }

  private List<Map<String, Object>> runSummaries(List<MinCutRun> runs, boolean includePartitions) {
    List<Map<String, Object>> summaries = new ArrayList<>(runs.size());
    for (MinCutRun run : runs) {
      Map<String, Object> map = new LinkedHashMap<>();
      map.put("algorithm", run.algorithm().displayName());
      map.put("repetitions", run.repetitions());
      map.put("trials_completed", run.trialsCompleted());
      map.put("cut_size", run.cutSize());
      map.put("time_ms", run.elapsedMillis());
      map.put("termination_reason", run.terminationReason());
      if (includePartitions) {
        CutPartition partition = run.partitions();
        map.put(
            "partitions",
            List.of(oneBased(partition.firstVertices()), oneBased(partition.secondVertices())));
      }
      summaries.add(map);
    }
    return summaries;
  }

  private List<Integer> oneBased(List<Integer> vertices) {
    return vertices.stream().map(v -> v + 1).toList();
  }
}
