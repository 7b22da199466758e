package bescan.editing.guide;

import java.io.File;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

import org.apache.log4j.Level;
import org.apache.log4j.Logger;

import bescan.core.error.BaseEditingException;
import bescan.core.error.InvalidWindowException;
import bescan.core.parser.CommandLineParser;
import bescan.core.sequence.CasPamTable;
import bescan.core.sequence.FastaGeneReader;
import bescan.core.sequence.GeneRecord;
import bescan.core.sequence.PamPattern;
import bescan.editing.gene.GuideCandidate;
import bescan.editing.gene.TargetGene;
import bescan.editing.gene.TargetGene.CandidateGuides;
import bescan.editing.guide.predicate.GuideCandidatePredicate;

/**
 * Generates base editing guides for one gene: enumerates guides on both strands, keeps those
 * next to a PAM with an editable base in the editing window, annotates them and removes guides
 * whose sequence occurs more than once.
 * <p>
 * A designer runs once. It moves through the {@link PipelineState}s in order and any failure
 * aborts the run with a {@link GuideGenerationException} naming the state it failed in.
 */
public class BaseEditorGuideDesigner {

	static Logger logger = Logger.getLogger(BaseEditorGuideDesigner.class.getName());

	private final GuideDesignConfiguration config;
	private PipelineState state;
	private String pamSpec;
	private PamPattern pam;
	private EditPair edit;
	private EditingWindow window;

	public BaseEditorGuideDesigner(GuideDesignConfiguration config) {
		this.config = config;
		this.state = PipelineState.INIT;
	}

	/**
	 * Design guides for a gene already in memory. The run ends in {@link PipelineState#DEDUPLICATED}.
	 * @param record Gene record
	 * @return The guide table
	 * @throws GuideGenerationException
	 */
	public GuideTable design(GeneRecord record) throws GuideGenerationException {
		return run(record, null, null);
	}

	/**
	 * Design guides for the gene in a FASTA file and write the table.
	 * The run ends in {@link PipelineState#EXPORTED}; nothing is written if it fails.
	 * @param geneFasta FASTA file with the gene record
	 * @param output Output CSV file
	 * @return The guide table
	 * @throws GuideGenerationException
	 */
	public GuideTable designAndExport(File geneFasta, File output) throws GuideGenerationException {
		return run(null, geneFasta, output);
	}

	private GuideTable run(GeneRecord record, File geneFasta, File output) throws GuideGenerationException {
		if(state != PipelineState.INIT) {
			throw new IllegalStateException("A designer can only run once. Current state " + state);
		}
		try {
			validateConfiguration();
			if(record == null) {
				record = new FastaGeneReader(config.getGenomicOffset()).read(geneFasta, config.getGeneName());
				logger.info("Create gene object from " + geneFasta);
			}

			TargetGene gene = new TargetGene(record);
			gene.parseExons();
			logger.info("Parsing exons: " + gene.getNumExons() + " exons found");
			gene.extractMetadata();
			advance(PipelineState.GENE_PARSED);

			CandidateGuides candidates = gene.findAllGuides(config.getGuideLength(), pam.length());
			logger.info(candidates.getNumWindows() + " candidate windows of length " + config.getGuideLength() + " on each strand");
			advance(PipelineState.GUIDES_ENUMERATED);

			List<GuideCandidatePredicate> predicates = GuideFilters.defaultPredicates(pam, edit, window);
			List<GuideCandidate> forward = GuideFilters.filterRepeats(GuideFilters.filter(candidates.getForward(), predicates));
			List<GuideCandidate> reverse = GuideFilters.filterRepeats(GuideFilters.filter(candidates.getReverse(), predicates));
			logger.info(forward.size() + " sense and " + reverse.size() + " antisense guides pass PAM " + pamSpec + " and edit " + edit + " in window " + window);
			advance(PipelineState.GUIDES_FILTERED);

			String geneName = config.getGeneName() != null ? config.getGeneName() : gene.getName();
			GuideAnnotator annotator = new GuideAnnotator(geneName, gene.getStrand(), window);
			GuideTable all = GuideTable.concatenate(annotate(annotator, forward), annotate(annotator, reverse));
			GuideTable table = all.removeAmbiguousGuides();
			logger.info("Removed " + (all.size() - table.size()) + " guides with ambiguous coding sequence, " + table.size() + " remain");
			advance(PipelineState.DEDUPLICATED);

			if(output != null) {
				new GuideTableWriter().write(table, output);
				advance(PipelineState.EXPORTED);
			}
			return table;
		} catch(BaseEditingException e) {
			logger.error("Aborting in state " + state + ": " + e.getMessage());
			throw new GuideGenerationException(state, e);
		} catch(IOException e) {
			logger.error("Aborting in state " + state + ": " + e.getMessage());
			throw new GuideGenerationException(state, e);
		} catch(IllegalArgumentException e) {
			logger.error("Aborting in state " + state + ": " + e.getMessage());
			throw new GuideGenerationException(state, e);
		}
	}

	/**
	 * Resolve the PAM and check the edit and window. Runs before the gene is read.
	 */
	private void validateConfiguration() {
		pamSpec = CasPamTable.resolve(config.getCasType(), config.getPam());
		pam = PamPattern.compile(pamSpec);
		edit = EditPair.of(config.getEditFrom(), config.getEditTo());
		if(config.getGuideLength() < 1) {
			throw new InvalidWindowException("Guide length must be positive. Is " + config.getGuideLength());
		}
		window = new EditingWindow(config.getWindowStart(), config.getWindowEnd());
		window.validateFits(config.getGuideLength());
		logger.debug("Validated configuration " + config.toString() + " resolved PAM " + pam.getPam());
	}

	private static List<AnnotatedGuide> annotate(GuideAnnotator annotator, List<GuideCandidate> guides) {
		List<AnnotatedGuide> rtrn = new ArrayList<AnnotatedGuide>();
		for(GuideCandidate g : guides) {
			rtrn.add(annotator.annotate(g));
		}
		return rtrn;
	}

	private void advance(PipelineState reached) {
		if(state.next() != reached) {
			throw new IllegalStateException("Cannot move from " + state + " to " + reached);
		}
		state = reached;
		logger.debug("Reached state " + state);
	}

	public PipelineState getState() {
		return state;
	}

	/**
	 * @return The resolved PAM, or null before validation
	 */
	public PamPattern getPam() {
		return pam;
	}

	public static void main(String[] args) {
		CommandLineParser p = new CommandLineParser();
		p.setProgramDescription("Generate base editing guides for a gene. Exons must be in upper case and introns in lower case.");
		p.addStringArg("-gene_file", "FASTA file with the gene sequence", true);
		p.addStringArg("-gene_name", "Gene name written to the table (default: FASTA record id)", false);
		p.addStringArg("-cas_type", "Cas type, one of " + CasPamTable.getCasTypes(), false, "SpCas9");
		p.addStringArg("-pam", "PAM, overrides the Cas type", false);
		p.addStringArg("-edit_from", "Base to be replaced", true);
		p.addStringArg("-edit_to", "Base to replace with", true);
		p.addIntegerArg("-window_start", "First guide position of the editing window, 0-based", false, Integer.valueOf(EditingWindow.DEFAULT.getFirst()));
		p.addIntegerArg("-window_end", "Last guide position of the editing window, inclusive", false, Integer.valueOf(EditingWindow.DEFAULT.getLast()));
		p.addIntegerArg("-guide_length", "Guide length", false, Integer.valueOf(GuideDesignConfiguration.DEFAULT_GUIDE_LENGTH));
		p.addIntegerArg("-offset", "Genomic position of the first base when the FASTA header has no range", false, Integer.valueOf(0));
		p.addStringArg("-output", "Output CSV file", false, "guides.csv");
		p.addBooleanArg("-debug", "Debug logging", false, Boolean.FALSE);
		try {
			p.parse(args);
		} catch(IllegalArgumentException e) {
			logger.error(e.getMessage());
			System.exit(1);
		}

		if(p.getBooleanArg("-debug")) {
			Logger.getLogger("bescan").setLevel(Level.DEBUG);
		}

		GuideDesignConfiguration config = new GuideDesignConfiguration(p.getStringArg("-gene_name"), p.getStringArg("-cas_type"), p.getStringArg("-pam"),
				p.getStringArg("-edit_from"), p.getStringArg("-edit_to"), p.getIntArg("-window_start"), p.getIntArg("-window_end"),
				p.getIntArg("-guide_length"), p.getIntArg("-offset"));
		try {
			new BaseEditorGuideDesigner(config).designAndExport(new File(p.getStringArg("-gene_file")), new File(p.getStringArg("-output")));
		} catch(GuideGenerationException e) {
			logger.error(e.getMessage());
			System.exit(1);
		}
	}

}
