package org.example.mjcf.export;

import org.example.mjcf.graph.KinematicAnalysis;

/**
 * The finished document together with the graph stages it was derived from.
 */
public record ExportResult(MjcfElement document, KinematicAnalysis analysis) {

    public String toXml() {
        return MjcfWriter.toXml(document);
    }
}
