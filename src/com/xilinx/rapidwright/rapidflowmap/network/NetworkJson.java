package com.xilinx.rapidwright.rapidflowmap.network;

import java.io.IOException;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonParseException;

import com.xilinx.rapidwright.rapidflowmap.MalformedNodeException;

/**
 * Reads and writes the JSON gate-list description of a {@link Network}.
 */
public class NetworkJson {
    private static class GateJson {
        public String name;
        public String function;
        public Integer truthTable;
        public List<String> fanins;
    }

    private static class OutputJson {
        public String name;
        public String driver;
    }

    private static class NetworkDescJson {
        public String name;
        public List<String> primaryInputs;
        public List<GateJson> gates;
        public OutputJson primaryOutput;
    }

    public static Network read(Path jsonFilePath) {
        try (Reader reader = Files.newBufferedReader(jsonFilePath)) {
            return read(reader, jsonFilePath.getFileName().toString());
        } catch (IOException e) {
            throw new UncheckedIOException("Fail to read network description: " + jsonFilePath, e);
        }
    }

    public static Network read(Reader reader, String defaultName) {
        Gson gson = new GsonBuilder().create();
        NetworkDescJson desc;
        try {
            desc = gson.fromJson(reader, NetworkDescJson.class);
        } catch (JsonParseException e) {
            throw new MalformedNodeException("Invalid network description " + defaultName + ": " + e.getMessage());
        }
        if (desc == null) {
            throw new MalformedNodeException("Empty network description: " + defaultName);
        }

        NetworkBuilder builder = new NetworkBuilder(desc.name != null ? desc.name : defaultName);
        if (desc.primaryInputs != null) {
            desc.primaryInputs.forEach(builder::addPrimaryInput);
        }

        if (desc.gates != null) {
            for (GateJson gate : desc.gates) {
                List<String> fanins = gate.fanins != null ? gate.fanins : List.of();
                int truthTable;
                if (gate.truthTable != null) {
                    truthTable = gate.truthTable;
                } else if (gate.function != null) {
                    truthTable = GateFunction.fromName(gate.function);
                } else {
                    throw new MalformedNodeException("Gate " + gate.name + " specifies neither function nor truthTable");
                }
                builder.addGate(gate.name, truthTable, fanins);
            }
        }

        if (desc.primaryOutput != null) {
            builder.setPrimaryOutput(desc.primaryOutput.name, desc.primaryOutput.driver);
        }
        return builder.build();
    }

    public static void write(Network network, Path jsonFilePath) {
        NetworkDescJson desc = new NetworkDescJson();
        desc.name = network.getName();
        desc.primaryInputs = new ArrayList<>();
        for (int inputId : network.getPrimaryInputs()) {
            desc.primaryInputs.add(network.getNode(inputId).getName());
        }

        desc.gates = new ArrayList<>();
        for (int nodeId : network.getTopologicalOrder()) {
            Node node = network.getNode(nodeId);
            if (!node.isGate()) continue;

            GateJson gate = new GateJson();
            gate.name = node.getName();
            if (GateFunction.hasName(node.getTruthTable())) {
                gate.function = GateFunction.toName(node.getTruthTable());
            } else {
                gate.truthTable = node.getTruthTable();
            }
            gate.fanins = new ArrayList<>();
            for (int faninId : node.getFanins()) {
                gate.fanins.add(network.getNode(faninId).getName());
            }
            desc.gates.add(gate);
        }

        desc.primaryOutput = new OutputJson();
        desc.primaryOutput.name = network.getNode(network.getPrimaryOutput()).getName();
        desc.primaryOutput.driver = network.getNode(network.getOutputDriver()).getName();

        Gson gson = new GsonBuilder().setPrettyPrinting().create();
        try (Writer writer = Files.newBufferedWriter(jsonFilePath)) {
            gson.toJson(desc, writer);
        } catch (IOException e) {
            throw new UncheckedIOException("Fail to write network description: " + jsonFilePath, e);
        }
    }
}
