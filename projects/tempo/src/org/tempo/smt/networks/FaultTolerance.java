package org.tempo.smt.networks;

import org.tempo.smt.*;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Networks whose links may fail.
 */
public class FaultTolerance {

    private FaultTolerance() {}

    /**
     * A copy of the network in which every transfer function delivers
     * {@code dropped} when its link has failed. The failure variables are
     * added to the symbolic values of the network.
     */
    public static Network withFailures(Network net, SymbolicFailures failures, RouteValue dropped) {
        Map<Edge, RouteFunction> transfer = net.getTopology().mapEdges(edge ->
                failures.asTransfer(edge, net.getTransferFunctions().get(edge), dropped));
        List<SymbolicValue> symbolics = new ArrayList<>(net.getSymbolics());
        symbolics.addAll(failures.getSymbolics());
        return new Network(net.getTopology(), net.getRouteType(), transfer, net.getMergeFunction(),
                net.getInitialValues(), symbolics, net.getPolicy(), net.getOptions());
    }

    /**
     * Fail up to {@code maxFailures} links of an option-typed network,
     * dropping routes to {@code none}.
     */
    public static Network withFailures(Network net, OptionType routeType, int maxFailures) {
        return withFailures(net, new SymbolicFailures(net.getTopology(), maxFailures), routeType::none);
    }
}
