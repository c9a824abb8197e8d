package com.toycon.graph.io;

import com.toycon.graph.api.Node;
import com.toycon.graph.engine.Connection;
import com.toycon.graph.engine.Graph;
import com.toycon.graph.node.NodeKind;

import lombok.extern.log4j.Log4j2;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Line-oriented save format.
 *
 * <pre>
 * TOYCON_v1
 * NODE &lt;id&gt; &lt;kind&gt; &lt;x&gt; &lt;y&gt; &lt;kind-specific-data&gt;
 * CONN &lt;sourceId&gt; &lt;sourceSlot&gt; &lt;targetId&gt; &lt;targetSlot&gt;
 * </pre>
 *
 * <p>
 * All NODE lines are written before any CONN line, in evaluation order, so a
 * reload reproduces the same order. Kind data is whatever
 * {@link Node#data()} returns and may itself contain spaces; it runs to the
 * end of the line.
 *
 * <p>
 * Reading is lenient per line: a NODE or CONN line that does not parse, names
 * an unknown kind, reuses an id or points at a missing node is logged at WARN
 * and skipped. Only a missing or unknown header rejects the whole text.
 */
@Log4j2
public final class GraphTextFormat {
    public static final String HEADER = "TOYCON_v1";

    private GraphTextFormat() {
        // Utility class
    }

    /** Serializes {@code graph}, one record per line, '\n' separated. */
    public static String write(Graph graph) {
        StringBuilder sb = new StringBuilder(64 + graph.size() * 48);
        sb.append(HEADER).append('\n');
        for (Node n : graph.nodes()) {
            sb.append("NODE ").append(n.id()).append(' ').append(n.kind().typeName())
                    .append(' ').append(n.x()).append(' ').append(n.y());
            String data = n.data();
            if (data != null && !data.isEmpty())
                sb.append(' ').append(data);
            sb.append('\n');
        }
        for (Connection c : graph.connections()) {
            sb.append("CONN ").append(c.sourceId()).append(' ').append(c.sourceSlot())
                    .append(' ').append(c.targetId()).append(' ').append(c.targetSlot()).append('\n');
        }
        return sb.toString();
    }

    /**
     * Parses text produced by {@link #write(Graph)} into a new graph.
     *
     * @throws GraphFormatException if the first non-blank line is not the
     *                              header.
     */
    public static Graph read(String text) {
        String[] lines = text.split("\r?\n");
        int i = 0;
        while (i < lines.length && lines[i].isBlank())
            i++;
        if (i >= lines.length)
            throw new GraphFormatException("Empty graph text, expected header " + HEADER);
        if (!lines[i].trim().equals(HEADER))
            throw new GraphFormatException("Unknown header '" + lines[i].trim() + "', expected " + HEADER);

        Graph graph = new Graph();
        int skipped = 0;
        for (int lineNo = i + 1; lineNo < lines.length; lineNo++) {
            String line = lines[lineNo].trim();
            if (line.isEmpty())
                continue;
            try {
                if (line.startsWith("NODE "))
                    readNode(graph, line);
                else if (line.startsWith("CONN "))
                    readConnection(graph, line);
                else
                    throw new IllegalArgumentException("Unrecognized record");
            } catch (RuntimeException e) {
                skipped++;
                log.warn("Skipping line {} '{}': {}", lineNo + 1, line, e.getMessage());
            }
        }
        log.debug("Read graph: {} nodes, {} lines skipped", graph.size(), skipped);
        return graph;
    }

    public static void save(Graph graph, Path file) throws IOException {
        Files.writeString(file, write(graph), StandardCharsets.UTF_8);
        log.info("Saved {} nodes to {}", graph.size(), file);
    }

    public static Graph load(Path file) throws IOException {
        Graph graph = read(Files.readString(file, StandardCharsets.UTF_8));
        log.info("Loaded {} nodes from {}", graph.size(), file);
        return graph;
    }

    private static void readNode(Graph graph, String line) {
        // NODE id kind x y [data...]
        String[] f = line.split("\\s+", 6);
        if (f.length < 5)
            throw new IllegalArgumentException("NODE needs id, kind, x and y");
        int id = Integer.parseInt(f[1]);
        if (id < 0)
            throw new IllegalArgumentException("Negative node id " + id);
        NodeKind kind = NodeKind.fromString(f[2]);
        int x = (int) Math.round(Double.parseDouble(f[3]));
        int y = (int) Math.round(Double.parseDouble(f[4]));
        Node node = kind.create(id, f.length == 6 ? f[5] : "");
        node.moveTo(x, y);
        graph.add(node);
    }

    private static void readConnection(Graph graph, String line) {
        String[] f = line.split("\\s+");
        if (f.length != 5)
            throw new IllegalArgumentException("CONN needs sourceId, sourceSlot, targetId and targetSlot");
        int sourceId = Integer.parseInt(f[1]);
        int sourceSlot = Integer.parseInt(f[2]);
        int targetId = Integer.parseInt(f[3]);
        int targetSlot = Integer.parseInt(f[4]);
        if (graph.node(sourceId) == null || graph.node(targetId) == null)
            throw new IllegalArgumentException("Connection references a missing node");
        graph.connect(sourceId, sourceSlot, targetId, targetSlot);
    }
}
