package nl.bytesoflife.heaterrisk.quote;

import nl.bytesoflife.heaterrisk.model.InspectionRecord;
import nl.bytesoflife.heaterrisk.model.VentType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Offline quote provider: unit prices from the built-in tier ladders and installation from the
 * contractor's presets, or the default presets for contractors without their own.
 *
 * <pre>
 * QuoteProvider provider = new PresetQuoteProvider()
 *     .withContractorPresets("acme-plumbing", presets);
 * </pre>
 */
public class PresetQuoteProvider implements QuoteProvider {

    private static final Logger log = LoggerFactory.getLogger(PresetQuoteProvider.class);

    private final Map<String, List<InstallPreset>> contractorPresets = new ConcurrentHashMap<>();
    private final List<InstallPreset> defaultPresets = InstallPreset.defaults();

    public PresetQuoteProvider withContractorPresets(String contractorId, List<InstallPreset> presets) {
        contractorPresets.put(contractorId, List.copyOf(presets));
        return this;
    }

    @Override
    public TotalQuote generateQuote(InspectionRecord record, String contractorId, InstallComplexity complexity)
            throws QuoteException {
        TierLadder ladder = BuiltinTierLadders.forFamily(record.getUnitFamily());
        TierProfile profile = ladder.classifyByWarranty(record.getWarrantyYears());

        int unitPrice = profile.baseCost(record.getUnitType());
        if (unitPrice <= 0) {
            throw new QuoteException("No " + profile.label() + " product for " + record.getUnitType());
        }

        InstallPreset preset = findPreset(contractorId, record.getVentType(), complexity);
        log.debug("Quoting {} {} for contractor {}: unit ${}, install ${} ({} {})",
                profile.label(), record.getUnitType(), contractorId, unitPrice,
                preset.totalCost(), preset.ventType(), preset.complexity());

        return TotalQuote.of(unitPrice, preset);
    }

    private InstallPreset findPreset(String contractorId, VentType ventType, InstallComplexity complexity)
            throws QuoteException {
        List<InstallPreset> presets = contractorPresets.getOrDefault(contractorId, defaultPresets);
        for (InstallPreset preset : presets) {
            if (preset.ventType() == ventType && preset.complexity() == complexity) {
                return preset;
            }
        }
        throw new QuoteException("Contractor " + contractorId + " has no install preset for "
                + ventType + " / " + complexity);
    }
}
