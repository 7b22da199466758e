package bescan.editing.gene;

public enum SegmentKind {
	EXON,
	INTRON;
}
