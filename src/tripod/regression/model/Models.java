package tripod.regression.model;

/**
 * Shared argument checks for the model catalog
 */
class Models {
    private Models () {}

    static IllegalArgumentException badIndex (Object model, int index,
                                              int numCoefficients) {
        return new IllegalArgumentException
            (model.getClass().getSimpleName()+": coefficient index "
             +index+" is not within [0,"+numCoefficients+")");
    }
}
