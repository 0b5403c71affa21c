package modernizer.syntax;

public interface PyNode {
    SourceSpan span();
}
