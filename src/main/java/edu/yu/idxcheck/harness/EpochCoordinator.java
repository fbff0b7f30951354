package edu.yu.idxcheck.harness;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import edu.yu.idxcheck.epoch.EpochGuard;
import edu.yu.idxcheck.epoch.EpochManager;
import edu.yu.idxcheck.epoch.ProtectedEpochs;

/**
 * The harness' view of the epoch manager shared with the index under test.
 * Guards handed out here must be closed by the caller, normally through
 * try-with-resources.
 */
public class EpochCoordinator {

    private static final Logger logger = LogManager.getLogger(EpochCoordinator.class);

    private final EpochManager epochManager;

    public EpochCoordinator(EpochManager epochManager) {
        if (epochManager == null) {
            throw new IllegalArgumentException("Epoch manager can't be null");
        }

        this.epochManager = epochManager;
    }

    public long forwardGlobalEpoch() {
        return this.epochManager.forwardGlobalEpoch();
    }

    public ProtectedEpochs getProtectedEpochs() {
        ProtectedEpochs protectedEpochs = this.epochManager.getProtectedEpochs();
        logger.debug("Captured {}", protectedEpochs);
        return protectedEpochs;
    }

    public EpochGuard createEpochGuard() {
        return this.epochManager.createEpochGuard();
    }
}
