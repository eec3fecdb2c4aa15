package com.xilinx.rapidwright.rapidflowmap.mapper;

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

import com.xilinx.rapidwright.rapidflowmap.network.Network;

/**
 * JSON form of a {@link MappedNetwork}, consumed by the HDL emission flow.
 */
public class MappedNetworkJson {
    public static class LutJson {
        public String name;
        public List<String> inputs;
        public int level;
        public String truthTable;
    }

    public static class OutputJson {
        public String name;
        public String driver;
    }

    public static class MappedNetworkDescJson {
        public String name;
        public int lutSize;
        public int depth;
        public int lutCount;
        public List<String> primaryInputs;
        public OutputJson primaryOutput;
        public List<LutJson> luts;
    }

    public static MappedNetworkDescJson toJson(MappedNetwork mappedNetwork) {
        Network network = mappedNetwork.getNetwork();
        MappedNetworkDescJson desc = new MappedNetworkDescJson();
        desc.name = network.getName();
        desc.lutSize = mappedNetwork.getLutSize();
        desc.depth = mappedNetwork.getDepth();
        desc.lutCount = mappedNetwork.getLutNum();

        desc.primaryInputs = new ArrayList<>();
        for (int inputId : network.getPrimaryInputs()) {
            desc.primaryInputs.add(network.getNode(inputId).getName());
        }

        desc.primaryOutput = new OutputJson();
        desc.primaryOutput.name = network.getNode(network.getPrimaryOutput()).getName();
        desc.primaryOutput.driver = network.getNode(network.getOutputDriver()).getName();

        desc.luts = new ArrayList<>();
        for (LutCell cell : mappedNetwork.getLutCells()) {
            LutJson lut = new LutJson();
            lut.name = cell.getName();
            lut.inputs = new ArrayList<>();
            for (int input : cell.getInputs()) {
                lut.inputs.add(network.getNode(input).getName());
            }
            lut.level = cell.getLevel();
            lut.truthTable = cell.getTruthTableString();
            desc.luts.add(lut);
        }
        return desc;
    }

    public static void write(MappedNetwork mappedNetwork, Path jsonFilePath) {
        Gson gson = new GsonBuilder().setPrettyPrinting().create();
        try (Writer writer = Files.newBufferedWriter(jsonFilePath)) {
            gson.toJson(toJson(mappedNetwork), writer);
        } catch (IOException e) {
            throw new UncheckedIOException("Fail to write mapped netlist: " + jsonFilePath, e);
        }
    }

    public static MappedNetworkDescJson read(Path jsonFilePath) {
        Gson gson = new GsonBuilder().create();
        try (Reader reader = Files.newBufferedReader(jsonFilePath)) {
            return gson.fromJson(reader, MappedNetworkDescJson.class);
        } catch (IOException e) {
            throw new UncheckedIOException("Fail to read mapped netlist: " + jsonFilePath, e);
        }
    }
}
