package cmdtree.common;

import java.util.List;

public interface Terminal {
    void stdout(String text);

    void stderr(String text);

    void exit(int code);

    List<String> args();
}
