package at.sv.edo.season;

/**
 * The 72 micro-seasons (七十二候), three consecutive 5 degree bands per solar term, in traditional order starting with
 * the first band of {@link SolarTerm#START_OF_SPRING} at 315 degrees.
 */
public enum MicroSeason {
    EAST_WIND_MELTS_ICE(SolarTerm.START_OF_SPRING, "東風解凍", "はるかぜこおりをとく"),
    BUSH_WARBLERS_SING(SolarTerm.START_OF_SPRING, "黄鶯睍睆", "うぐいすなく"),
    FISH_EMERGE_FROM_ICE(SolarTerm.START_OF_SPRING, "魚上氷", "うおこおりをいずる"),
    RAIN_MOISTENS_SOIL(SolarTerm.RAIN_WATER, "土脉潤起", "つちのしょううるおいおこる"),
    MIST_STARTS_TO_LINGER(SolarTerm.RAIN_WATER, "霞始靆", "かすみはじめてたなびく"),
    GRASS_SPROUTS(SolarTerm.RAIN_WATER, "草木萌動", "そうもくめばえいずる"),
    HIBERNATING_INSECTS_SURFACE(SolarTerm.AWAKENING_OF_INSECTS, "蟄虫啓戸", "すごもりむしとをひらく"),
    PEACH_BLOSSOMS_BLOOM(SolarTerm.AWAKENING_OF_INSECTS, "桃始笑", "ももはじめてさく"),
    CATERPILLARS_BECOME_BUTTERFLIES(SolarTerm.AWAKENING_OF_INSECTS, "菜虫化蝶", "なむしちょうとなる"),
    SPARROWS_START_TO_NEST(SolarTerm.VERNAL_EQUINOX, "雀始巣", "すずめはじめてすくう"),
    CHERRY_BLOSSOMS_BLOOM(SolarTerm.VERNAL_EQUINOX, "櫻始開", "さくらはじめてひらく"),
    DISTANT_THUNDER(SolarTerm.VERNAL_EQUINOX, "雷乃発声", "かみなりすなわちこえをはっす"),
    SWALLOWS_RETURN(SolarTerm.CLEAR_AND_BRIGHT, "玄鳥至", "つばめきたる"),
    WILD_GEESE_FLY_NORTH(SolarTerm.CLEAR_AND_BRIGHT, "鴻雁北", "こうがんかえる"),
    FIRST_RAINBOWS(SolarTerm.CLEAR_AND_BRIGHT, "虹始見", "にじはじめてあらわる"),
    REEDS_SPROUT(SolarTerm.GRAIN_RAIN, "葭始生", "あしはじめてしょうず"),
    RICE_SEEDLINGS_GROW(SolarTerm.GRAIN_RAIN, "霜止出苗", "しもやんでなえいずる"),
    PEONIES_BLOOM(SolarTerm.GRAIN_RAIN, "牡丹華", "ぼたんはなさく"),
    FROGS_START_SINGING(SolarTerm.START_OF_SUMMER, "蛙始鳴", "かわずはじめてなく"),
    WORMS_SURFACE(SolarTerm.START_OF_SUMMER, "蚯蚓出", "みみずいずる"),
    BAMBOO_SHOOTS_SPROUT(SolarTerm.START_OF_SUMMER, "竹笋生", "たけのこしょうず"),
    SILKWORMS_FEAST_ON_MULBERRY(SolarTerm.GRAIN_BUDS, "蚕起食桑", "かいこおきてくわをはむ"),
    SAFFLOWERS_BLOOM(SolarTerm.GRAIN_BUDS, "紅花栄", "べにばなさかう"),
    WHEAT_RIPENS(SolarTerm.GRAIN_BUDS, "麦秋至", "むぎのときいたる"),
    PRAYING_MANTISES_HATCH(SolarTerm.GRAIN_IN_EAR, "蟷螂生", "かまきりしょうず"),
    FIREFLIES_RISE_FROM_GRASS(SolarTerm.GRAIN_IN_EAR, "腐草為螢", "くされたるくさほたるとなる"),
    PLUMS_TURN_YELLOW(SolarTerm.GRAIN_IN_EAR, "梅子黄", "うめのみきばむ"),
    SELF_HEAL_WITHERS(SolarTerm.SUMMER_SOLSTICE, "乃東枯", "なつかれくさかるる"),
    IRISES_BLOOM(SolarTerm.SUMMER_SOLSTICE, "菖蒲華", "あやめはなさく"),
    CROW_DIPPER_SPROUTS(SolarTerm.SUMMER_SOLSTICE, "半夏生", "はんげしょうず"),
    WARM_WINDS_BLOW(SolarTerm.MINOR_HEAT, "温風至", "あつかぜいたる"),
    LOTUSES_BLOOM(SolarTerm.MINOR_HEAT, "蓮始開", "はすはじめてひらく"),
    HAWKS_LEARN_TO_FLY(SolarTerm.MINOR_HEAT, "鷹乃学習", "たかすなわちわざをならう"),
    PAULOWNIA_SEEDS(SolarTerm.MAJOR_HEAT, "桐始結花", "きりはじめてはなをむすぶ"),
    EARTH_IS_DAMP(SolarTerm.MAJOR_HEAT, "土潤溽暑", "つちうるおうてむしあつし"),
    GREAT_RAINS_SOMETIMES_FALL(SolarTerm.MAJOR_HEAT, "大雨時行", "たいうときどきふる"),
    COOL_WINDS_BLOW(SolarTerm.START_OF_AUTUMN, "涼風至", "すずかぜいたる"),
    EVENING_CICADAS_SING(SolarTerm.START_OF_AUTUMN, "寒蝉鳴", "ひぐらしなく"),
    THICK_FOG_DESCENDS(SolarTerm.START_OF_AUTUMN, "蒙霧升降", "ふかききりまとう"),
    COTTON_FLOWERS_BLOOM(SolarTerm.END_OF_HEAT, "綿柎開", "わたのはなしべひらく"),
    HEAT_STARTS_TO_DIE_DOWN(SolarTerm.END_OF_HEAT, "天地始粛", "てんちはじめてさむし"),
    RICE_RIPENS(SolarTerm.END_OF_HEAT, "禾乃登", "こくものすなわちみのる"),
    DEW_GLISTENS_WHITE(SolarTerm.WHITE_DEW, "草露白", "くさのつゆしろし"),
    WAGTAILS_SING(SolarTerm.WHITE_DEW, "鶺鴒鳴", "せきれいなく"),
    SWALLOWS_LEAVE(SolarTerm.WHITE_DEW, "玄鳥去", "つばめさる"),
    THUNDER_CEASES(SolarTerm.AUTUMN_EQUINOX, "雷乃収声", "かみなりすなわちこえをおさむ"),
    INSECTS_HOLE_UP(SolarTerm.AUTUMN_EQUINOX, "蟄虫坏戸", "むしかくれてとをふさぐ"),
    FIELDS_ARE_DRAINED(SolarTerm.AUTUMN_EQUINOX, "水始涸", "みずはじめてかるる"),
    WILD_GEESE_RETURN(SolarTerm.COLD_DEW, "鴻雁来", "こうがんきたる"),
    CHRYSANTHEMUMS_BLOOM(SolarTerm.COLD_DEW, "菊花開", "きくのはなひらく"),
    CRICKETS_CHIRP_AROUND_DOOR(SolarTerm.COLD_DEW, "蟋蟀在戸", "きりぎりすとにあり"),
    FIRST_FROST(SolarTerm.FROST_DESCENT, "霜始降", "しもはじめてふる"),
    LIGHT_RAINS_SOMETIMES_FALL(SolarTerm.FROST_DESCENT, "霎時施", "こさめときどきふる"),
    MAPLES_AND_IVY_TURN_YELLOW(SolarTerm.FROST_DESCENT, "楓蔦黄", "もみじつたきばむ"),
    CAMELLIAS_BLOOM(SolarTerm.START_OF_WINTER, "山茶始開", "つばきはじめてひらく"),
    LAND_STARTS_TO_FREEZE(SolarTerm.START_OF_WINTER, "地始凍", "ちはじめてこおる"),
    DAFFODILS_BLOOM(SolarTerm.START_OF_WINTER, "金盞香", "きんせんかさく"),
    RAINBOWS_HIDE(SolarTerm.MINOR_SNOW, "虹蔵不見", "にじかくれてみえず"),
    NORTH_WIND_BLOWS_LEAVES(SolarTerm.MINOR_SNOW, "朔風払葉", "きたかぜこのはをはらう"),
    TACHIBANA_TURNS_YELLOW(SolarTerm.MINOR_SNOW, "橘始黄", "たちばなはじめてきばむ"),
    COLD_SETS_IN(SolarTerm.MAJOR_SNOW, "閉塞成冬", "そらさむくふゆとなる"),
    BEARS_HIBERNATE(SolarTerm.MAJOR_SNOW, "熊蟄穴", "くまあなにこもる"),
    SALMON_GATHER(SolarTerm.MAJOR_SNOW, "鱖魚群", "さけのうおむらがる"),
    SELF_HEAL_SPROUTS(SolarTerm.WINTER_SOLSTICE, "乃東生", "なつかれくさしょうず"),
    DEER_SHED_ANTLERS(SolarTerm.WINTER_SOLSTICE, "麋角解", "さわしかつのおつる"),
    WHEAT_SPROUTS_UNDER_SNOW(SolarTerm.WINTER_SOLSTICE, "雪下出麦", "ゆきわたりてむぎのびる"),
    PARSLEY_FLOURISHES(SolarTerm.MINOR_COLD, "芹乃栄", "せりすなわちさかう"),
    SPRINGS_THAW(SolarTerm.MINOR_COLD, "水泉動", "しみずあたたかをふくむ"),
    PHEASANTS_START_TO_CALL(SolarTerm.MINOR_COLD, "雉始雊", "きじはじめてなく"),
    BUTTERBURS_BUD(SolarTerm.MAJOR_COLD, "款冬華", "ふきのはなさく"),
    ICE_THICKENS_ON_STREAMS(SolarTerm.MAJOR_COLD, "水沢腹堅", "さわみずこおりつめる"),
    HENS_START_LAYING(SolarTerm.MAJOR_COLD, "鶏始乳", "にわとりはじめてとやにつく");

    public static final double BAND_WIDTH = 5.0;
    static final double ORIGIN_LONGITUDE = 315.0;

    private final SolarTerm solarTerm;
    private final String label;
    private final String reading;

    MicroSeason(SolarTerm solarTerm, String label, String reading) {
        this.solarTerm = solarTerm;
        this.label = label;
        this.reading = reading;
    }

    public SolarTerm getSolarTerm() {
        return solarTerm;
    }

    public String getLabel() {
        return label;
    }

    public String getReading() {
        return reading;
    }

    /**
     * @return 1, 2 or 3: the position of this micro-season within its solar term
     */
    public int getIndexInTerm() {
        return ordinal() % 3 + 1;
    }

    public double getStartLongitude() {
        return (ORIGIN_LONGITUDE + ordinal() * BAND_WIDTH) % 360;
    }

    public double getEndLongitude() {
        return getStartLongitude() + BAND_WIDTH;
    }
}
