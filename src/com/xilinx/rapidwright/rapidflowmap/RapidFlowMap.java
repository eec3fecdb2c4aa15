package com.xilinx.rapidwright.rapidflowmap;

import java.nio.file.Path;

import com.xilinx.rapidwright.rapidflowmap.mapper.MappedNetwork;
import com.xilinx.rapidwright.rapidflowmap.mapper.MappedNetworkJson;
import com.xilinx.rapidwright.rapidflowmap.mapper.MappingState;
import com.xilinx.rapidwright.rapidflowmap.mapper.TechnologyMapper;


public class RapidFlowMap extends AbstractApplication {

    private TechnologyMapper technologyMapper;
    private MappingState mappingState;
    private MappedNetwork depthOptimalNetwork;
    private MappedNetwork mappedNetwork;
    private Boolean equivalent;
    private Path outputPath;

    public RapidFlowMap(String jsonFilePath, boolean enableLogger) {
        super(jsonFilePath, enableLogger);
        technologyMapper = new TechnologyMapper(logger, mapperParams.getMapperConfig());
    }

    private void runLabeling() {
        logger.infoHeader("FlowMap Labeling");
        logger.info(technologyMapper.getConfig().toString());
        mappingState = technologyMapper.label(inputNetwork);
    }

    private void runDepthMapping() {
        logger.infoHeader("Depth-Optimal Mapping");
        depthOptimalNetwork = technologyMapper.mapForDepth(mappingState);
        mappedNetwork = depthOptimalNetwork;
        depthOptimalNetwork.printMappedNetworkInfo(logger);
    }

    private void runAreaRecovery() {
        logger.infoHeader("Area Recovery");
        if (!mapperParams.isAreaRecovery()) {
            logger.info("Area recovery is disabled");
            return;
        }
        mappedNetwork = technologyMapper.recoverArea(mappingState, depthOptimalNetwork);
        mappedNetwork.printMappedNetworkInfo(logger);
    }

    private void runVerification() {
        logger.infoHeader("Equivalence Verification");
        int inputNum = inputNetwork.getPrimaryInputNum();
        if (!mapperParams.isVerifyEquivalence()) {
            logger.info("Equivalence verification is disabled");
            return;
        }
        if (inputNum > mapperParams.getMaxVerifyInputs()) {
            logger.warning(String.format("Skip exhaustive verification: %d primary inputs exceed the limit of %d",
                inputNum, mapperParams.getMaxVerifyInputs()));
            return;
        }

        equivalent = mappedNetwork.isEquivalentToNetwork();
        if (!equivalent) {
            throw new IllegalStateException("Mapped netlist of " + inputNetwork.getName() + " is not equivalent to the input network");
        }
        logger.info(String.format("Mapped netlist matches the network on all %d input assignments", 1L << inputNum));
    }

    private void writeMappedNetlist() {
        logger.infoHeader("Write Mapped Netlist");
        outputPath = dirManager.getRootDir().resolve(mapperParams.getDesignName() + "_mapped.json");
        MappedNetworkJson.write(mappedNetwork, outputPath);
        logger.info("Write mapped netlist to " + outputPath);
    }

    public void run(FlowMapStep endStep) {
        logger.info("Start running RapidFlowMap");

        FlowMapStep[] orderedSteps = FlowMapStep.getOrderedSteps();

        for (FlowMapStep step : orderedSteps) {
            switch (step) {
                case READ_NETWORK:
                    runTimed("Read Network", this::readInputNetwork);
                    break;

                case LABELING:
                    runTimed("Labeling", this::runLabeling);
                    break;

                case DEPTH_MAPPING:
                    runTimed("Depth Mapping", this::runDepthMapping);
                    break;

                case AREA_RECOVERY:
                    runTimed("Area Recovery", this::runAreaRecovery);
                    break;

                case VERIFICATION:
                    runTimed("Verification", this::runVerification);
                    break;

                case WRITE_NETLIST:
                    runTimed("Write Netlist", this::writeMappedNetlist);
                    break;

                default:
                    break;
            }

            if (step == endStep) {
                break;
            }
        }

        logger.info(getRuntimeReport());

        logger.info("Complete running RapidFlowMap");
    }

    public void run() {
        run(FlowMapStep.getLastStep());
    }

    public MapperParams getMapperParams() {
        return mapperParams;
    }

    public MappingState getMappingState() {
        return mappingState;
    }

    public MappedNetwork getDepthOptimalNetwork() {
        return depthOptimalNetwork;
    }

    public MappedNetwork getMappedNetwork() {
        return mappedNetwork;
    }

    // null when verification was skipped
    public Boolean isEquivalent() {
        return equivalent;
    }

    public Path getOutputPath() {
        return outputPath;
    }

    public static void main(String[] args) {
        if (args.length != 1) {
            System.err.println("Usage: RapidFlowMap <parameter json file>");
            System.exit(1);
        }
        RapidFlowMap rapidFlowMap = new RapidFlowMap(args[0], true);
        rapidFlowMap.run();
    }
}
