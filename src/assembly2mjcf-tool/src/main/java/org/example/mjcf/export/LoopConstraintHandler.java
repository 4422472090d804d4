package org.example.mjcf.export;

import org.example.mjcf.Logger;
import org.example.mjcf.UnsupportedFeatureException;
import org.example.mjcf.graph.Graph;

import java.util.ArrayList;
import java.util.List;

/**
 * Closes kinematic loops. Every joint left out of the spanning tree becomes
 * an equality constraint; only rigid joints (welds) can be expressed this way.
 */
public final class LoopConstraintHandler {

    static final String WELD_SOLREF = "0.02 1";
    static final String WELD_SOLIMP = "0.9 0.95 0.001";

    private LoopConstraintHandler() {
    }

    public static List<MjcfElement> constraints(List<Graph.Link> unusedEdges) {
        List<MjcfElement> result = new ArrayList<>();
        for (Graph.Link link : unusedEdges) {
            if (!link.edge().kind().isRigid()) {
                throw new UnsupportedFeatureException("Joint '" + link.edge().name() + "' of kind "
                    + link.edge().kind() + " closes a kinematic loop between '" + link.from().key()
                    + "' and '" + link.to().key() + "'; only fixed joints can close loops");
            }
            Logger.debug("Welding '%s' to '%s' for joint '%s'",
                link.from().key(), link.to().key(), link.edge().name());
            result.add(MjcfElement.builder("weld")
                .attr("name", link.edge().name())
                .attr("body1", link.from().key())
                .attr("body2", link.to().key())
                .attr("solref", WELD_SOLREF)
                .attr("solimp", WELD_SOLIMP)
                .build());
        }
        return result;
    }
}
