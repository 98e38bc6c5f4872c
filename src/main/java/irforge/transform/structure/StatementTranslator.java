package irforge.transform.structure;

import irforge.base.llbc.Statement;

/**
 * Maps the statements of an unstructured block to structured statements.
 */
class StatementTranslator {

    static Statement translate(irforge.base.ullbc.Statement st) {
        if (st instanceof irforge.base.ullbc.Statement.Assign s) {
            return new Statement.Assign(s.span, s.place, s.rvalue);
        } else if (st instanceof irforge.base.ullbc.Statement.FakeRead s) {
            return new Statement.FakeRead(s.span, s.place);
        } else if (st instanceof irforge.base.ullbc.Statement.SetDiscriminant s) {
            return new Statement.SetDiscriminant(s.span, s.place, s.variant);
        } else if (st instanceof irforge.base.ullbc.Statement.StorageDead s) {
            return new Statement.StorageDead(s.span, s.local);
        } else if (st instanceof irforge.base.ullbc.Statement.Deinit s) {
            return new Statement.Deinit(s.span, s.place);
        } else if (st instanceof irforge.base.ullbc.Statement.Assert s) {
            return new Statement.Assert(s.span, s.cond, s.expected);
        } else if (st instanceof irforge.base.ullbc.Statement.Nop s) {
            return new Statement.Nop(s.span);
        }
        throw new IllegalStateException("Unhandled statement " + st.getClass().getSimpleName());
    }
}
