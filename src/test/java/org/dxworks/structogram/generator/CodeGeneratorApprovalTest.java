package org.dxworks.structogram.generator;

import org.approvaltests.Approvals;
import org.dxworks.structogram.Language;
import org.dxworks.structogram.TestUtils;
import org.dxworks.structogram.model.Node;
import org.dxworks.structogram.parser.PseudocodeParser;
import org.junit.jupiter.api.Test;

import java.io.IOException;

public class CodeGeneratorApprovalTest {

    @Test
    void generate_Python_Program() throws IOException {
        verify("pseudocode/program.txt", Language.PYTHON);
    }

    @Test
    void generate_Java_Program() throws IOException {
        verify("pseudocode/program.txt", Language.JAVA);
    }

    @Test
    void generate_JavaScript_Program() throws IOException {
        verify("pseudocode/program.txt", Language.JAVASCRIPT);
    }

    private static void verify(String sample, Language language) throws IOException {
        Node tree = new PseudocodeParser().parse(TestUtils.sample(sample));
        Approvals.verify(CodeGenerator.generate(tree, language.getName()));
    }
}
