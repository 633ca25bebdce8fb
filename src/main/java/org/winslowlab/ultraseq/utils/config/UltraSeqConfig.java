package org.winslowlab.ultraseq.utils.config;

import org.aeonbits.owner.Accessible;
import org.aeonbits.owner.Config.LoadPolicy;
import org.aeonbits.owner.Config.LoadType;
import org.aeonbits.owner.Config.Sources;

/**
 * Configuration file for UltraSeq options.
 * All specified {@code Sources} will be loaded.
 * The {@link LoadPolicy} is set to {@link LoadType#MERGE}, which specifies that if a configuration option is not found
 * in the first source, the option will be sought in all following sources until a definition is found.
 * If the option is not specified in any file, the coded default value will be used (as defined by @DefaultValue).
 *
 * The load order is always resolved "top-down" by declaration order in the @Sources annotation.
 *
 * In this case, the load order is:
 *        1)   "file:${" + UltraSeqConfig.CONFIG_FILE_VARIABLE_FILE_NAME + "}",
 *        2)   "file:UltraSeqConfig.properties",
 *        3)   "classpath:org/winslowlab/ultraseq/utils/config/UltraSeqConfig.properties"
 *        4)   hard-coded values specified by @DefaultValue
 *
 */
@LoadPolicy(LoadType.MERGE)
@Sources({
        "file:${" + UltraSeqConfig.CONFIG_FILE_VARIABLE_FILE_NAME + "}",          // Variable for file loading
        "file:UltraSeqConfig.properties",                                         // Default path
        "classpath:org/winslowlab/ultraseq/utils/config/UltraSeqConfig.properties" // Class path
})
public interface UltraSeqConfig extends Accessible {

    /**
     * Name of the configuration file variable to be used in the {@link Sources} annotation for {@link UltraSeqConfig}
     * as a place to find the configuration file corresponding to this interface.
     */
    String CONFIG_FILE_VARIABLE_FILE_NAME = "UltraSeqConfig.pathToConfig";

    // ----------------------------------------------------------
    // Miscellaneous Options:
    // ----------------------------------------------------------

    @Key("ultraseq_stacktrace_on_user_exception")
    @DefaultValue("false")
    boolean ultraseq_stacktrace_on_user_exception();

    // ----------------------------------------------------------
    // Read structure Options:
    // ----------------------------------------------------------

    /**
     * Structure searched for in mate 1: anchor, clonal barcode, anchor, first guide, anchor.
     */
    @Key("read1_structure")
    @DefaultValue("TAGTT(.{16})TATGG(.{16,21})GTTTA")
    String read1_structure();

    /**
     * Structure searched for in the reverse complement of mate 2: anchor, second guide, anchor.
     */
    @Key("read2_structure")
    @DefaultValue("TGTTG(.{16,21})GTTTG")
    String read2_structure();

    // ----------------------------------------------------------
    // Guide reference Options:
    // ----------------------------------------------------------

    @Key("guide_position_column")
    @DefaultValue("Position")
    String guide_position_column();

    @Key("guide_sequence_column")
    @DefaultValue("gRNA_complete")
    String guide_sequence_column();

    @Key("guide_position_1")
    @DefaultValue("G1")
    String guide_position_1();

    @Key("guide_position_2")
    @DefaultValue("G2")
    String guide_position_2();
}
