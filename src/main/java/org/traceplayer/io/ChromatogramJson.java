package org.traceplayer.io;

import java.util.Collection;
import java.util.EnumMap;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;

import org.traceplayer.model.Channel;
import org.traceplayer.model.ChromatogramRecord;
import org.traceplayer.model.FileFormat;

/**
 * JSON hand-off of a record and its hand-edited positions, for collaborators such
 * as a review workflow that store or display the corrected read.
 */
public final class ChromatogramJson {

  private static final Gson gson = new GsonBuilder().disableHtmlEscaping().create();

  private ChromatogramJson() {}

  /** A decoded record with the 0-based positions edited in the viewer. */
  public record Snapshot(ChromatogramRecord record, Set<Integer> editedIndices) {}

  public static String toJson(ChromatogramRecord record, Collection<Integer> editedIndices) {
    JsonObject json = new JsonObject();
    json.addProperty("fileName", record.getFileName());
    json.addProperty("fileFormat", record.getFileFormat().name());
    json.addProperty("sequenceLength", record.getSequenceLength());
    json.addProperty("sequence", record.getSequence());

    JsonArray quality = new JsonArray();
    for (int q : record.getQuality()) quality.add(q);
    json.add("quality", quality);

    JsonArray peaks = new JsonArray();
    for (int p : record.getPeakLocations()) peaks.add(p);
    json.add("peakLocations", peaks);

    JsonObject traces = new JsonObject();
    for (Channel channel : Channel.values()) {
      JsonArray samples = new JsonArray();
      for (double v : record.getTraces().get(channel)) samples.add(v);
      traces.add(String.valueOf(channel.symbol()), samples);
    }
    json.add("traces", traces);

    JsonArray edited = new JsonArray();
    for (int index : new TreeSet<>(editedIndices)) edited.add(index);
    json.add("editedPositions", edited);

    return gson.toJson(json);
  }

  /**
   * Rebuild a record from {@link #toJson}. The base calls come from "sequence".
   * @throws JsonParseException on malformed or incomplete JSON
   */
  public static Snapshot fromJson(String text) {
    try {
      JsonObject json = JsonParser.parseString(text).getAsJsonObject();
      String sequence = json.get("sequence").getAsString();
      int[] quality = toIntArray(json.getAsJsonArray("quality"));
      int[] peaks = toIntArray(json.getAsJsonArray("peakLocations"));

      Map<Channel, double[]> traces = new EnumMap<>(Channel.class);
      JsonObject traceJson = json.getAsJsonObject("traces");
      for (Channel channel : Channel.values()) {
        JsonArray samples = traceJson.getAsJsonArray(String.valueOf(channel.symbol()));
        double[] values = new double[samples == null ? 0 : samples.size()];
        for (int i = 0; i < values.length; i++) values[i] = samples.get(i).getAsDouble();
        traces.put(channel, values);
      }

      Set<Integer> edited = new TreeSet<>();
      JsonArray editedJson = json.getAsJsonArray("editedPositions");
      if (editedJson != null) {
        for (JsonElement e : editedJson) edited.add(e.getAsInt());
      }

      ChromatogramRecord record = new ChromatogramRecord(json.get("fileName").getAsString(),
          FileFormat.valueOf(json.get("fileFormat").getAsString()), traces, sequence.toCharArray(), quality, peaks);
      return new Snapshot(record, edited);
    } catch (NullPointerException | IllegalStateException | IllegalArgumentException | ClassCastException e) {
      throw new JsonParseException("Invalid chromatogram JSON: " + e.getMessage(), e);
    }
  }

  private static int[] toIntArray(JsonArray array) {
    int[] values = new int[array.size()];
    for (int i = 0; i < values.length; i++) values[i] = array.get(i).getAsInt();
    return values;
  }
}
